package org.pragmatica.table.cell;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;

/**
 * Ready-made cell content for adapters that do not bring their own node type.
 *
 * <p>Appending is associative and normalized: nested node lists are flattened, empty content
 * disappears and adjacent text runs are joined.
 */
public sealed interface Content {

    Empty EMPTY = new Empty();

    /**
     * Combiner for {@code Table<Content>} merges; a {@code null} content on either side is neutral.
     */
    BinaryOperator<Content> APPENDER = (left, right) -> left == null ? right : left.append(right);

    /**
     * Plain text of this content, markup stripped.
     */
    String text();

    /**
     * This content followed by {@code other}; {@code null} counts as {@link #EMPTY}.
     */
    default Content append(Content other) {
        return nodes(List.of(this, other == null ? EMPTY : other));
    }

    static Content of(String value) {
        return value.isEmpty()
               ? EMPTY
               : new Text(value);
    }

    static Content markup(String name, Map<String, String> attributes, List<Content> children) {
        return new Markup(name, attributes, children);
    }

    /**
     * Normalized sequence of the given items.
     */
    static Content nodes(List<Content> items) {
        var flat = new ArrayList<Content>();
        flatten(items, flat);
        if (flat.isEmpty()) {
            return EMPTY;
        }
        return flat.size() == 1
               ? flat.get(0)
               : new Nodes(flat);
    }

    private static void flatten(List<Content> items, List<Content> out) {
        for (var item : items) {
            if (item instanceof Nodes nodes) {
                flatten(nodes.items(), out);
            } else if (item instanceof Text text && !out.isEmpty() && out.get(out.size() - 1) instanceof Text last) {
                out.set(out.size() - 1, new Text(last.value() + text.value()));
            } else if (!(item instanceof Empty)) {
                out.add(item);
            }
        }
    }

    /**
     * No content at all.
     */
    record Empty() implements Content {
        @Override
        public String text() {
            return "";
        }
    }

    /**
     * A text run.
     */
    record Text(String value) implements Content {
        @Override
        public String text() {
            return value;
        }
    }

    /**
     * A markup element (paragraph, emphasis, ...) with its children.
     */
    record Markup(
    String name,
    Map<String, String> attributes,
    List<Content> children) implements Content {
        public Markup {
            attributes = ImmutableMap.copyOf(attributes);
            children = List.copyOf(children);
        }

        @Override
        public String text() {
            var sb = new StringBuilder();
            children.forEach(child -> sb.append(child.text()));
            return sb.toString();
        }
    }

    /**
     * Several nodes side by side, typically the result of merging cells.
     */
    record Nodes(List<Content> items) implements Content {
        public Nodes {
            items = List.copyOf(items);
        }

        @Override
        public String text() {
            var sb = new StringBuilder();
            items.forEach(item -> sb.append(item.text()));
            return sb.toString();
        }
    }
}
