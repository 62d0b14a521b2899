package org.pragmatica.table.cell;

import org.pragmatica.table.error.TableError;
import org.pragmatica.table.error.TableException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Combiners used to merge the contents of cells.
 */
public final class ContentAppenders {
    private ContentAppenders() {}

    /**
     * Default combiner: {@code null} is neutral, strings concatenate, {@link Content} appends,
     * lists concatenate and a list followed by a value gets the value appended.
     *
     * <p>Any other pair of values fails with {@link TableError.UnsupportedContent}; callers
     * storing such contents must pass their own combiner to the merge.
     */
    public static <C> BinaryOperator<C> natural() {
        return ContentAppenders::appendNatural;
    }

    /**
     * Join the text of both contents with {@code separator}, for {@code String} tables.
     */
    public static BinaryOperator<String> joining(String separator) {
        return (left, right) -> left == null
                                ? right
                                : right == null
                                  ? left
                                  : left + separator + right;
    }

    @SuppressWarnings("unchecked")
    private static <C> C appendNatural(C left, C right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return (C) (left.toString() + right);
        }
        if (left instanceof Content leftNode && right instanceof Content rightNode) {
            return (C) leftNode.append(rightNode);
        }
        if (left instanceof List<?> leftItems) {
            var items = new ArrayList<Object>(leftItems);
            if (right instanceof List<?> rightItems) {
                items.addAll(rightItems);
            } else {
                items.add(right);
            }
            return (C) items;
        }
        throw new TableException(new TableError.UnsupportedContent(left.getClass().getName(),
                                                                   right.getClass().getName()));
    }
}
