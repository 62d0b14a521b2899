package org.pragmatica.table.cell;

import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;
import org.pragmatica.table.geometry.Size;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A grid cell: user content, styles, a nature and the box it occupies.
 *
 * <p>The content can be anything the format adapter works with (a string, an XML node, a list of
 * nodes, {@link Content}, ...). The same content reference may be shared by several cells; copying
 * it is the caller's business.
 *
 * <p>The box is fixed for the life of the cell. Moving or resizing returns a new cell, which is
 * how the grid places cells without touching the caller's instance.
 *
 * @param <C> content type
 */
public final class Cell<C> extends Styled implements Comparable<Cell<?>> {
    private C content;
    private final Box box;

    public Cell(C content, Map<String, String> styles, String nature, Box box) {
        super(styles, nature);
        this.content = content;
        this.box = checkNotNull(box, "box");
    }

    /**
     * 1x1 body cell at the origin.
     */
    public static <C> Cell<C> of(C content) {
        return new Cell<>(content, null, BODY, Box.at(Coord.ORIGIN));
    }

    public static <C> Cell<C> of(C content, int x, int y) {
        return new Cell<>(content, null, BODY, Box.at(x, y));
    }

    public static <C> Cell<C> of(C content, int x, int y, int width, int height) {
        return new Cell<>(content, null, BODY, Box.of(Coord.of(x, y), Size.of(width, height)));
    }

    public static <C> Builder<C> builder(C content) {
        return new Builder<>(content);
    }

    public C content() {
        return content;
    }

    public void setContent(C content) {
        this.content = content;
    }

    public Box box() {
        return box;
    }

    /**
     * Top-left coordinate.
     */
    public Coord min() {
        return box.min();
    }

    /**
     * Bottom-right coordinate.
     */
    public Coord max() {
        return box.max();
    }

    public Size size() {
        return box.size();
    }

    /**
     * Number of spanned columns.
     */
    public int width() {
        return box.width();
    }

    /**
     * Number of spanned rows.
     */
    public int height() {
        return box.height();
    }

    public boolean contains(Coord coord) {
        return box.contains(coord);
    }

    public boolean contains(Box other) {
        return box.contains(other);
    }

    /**
     * Copy of this cell moved to {@code coord} and resized to {@code size}.
     */
    public Cell<C> transform(Coord coord, Size size) {
        return new Cell<>(content, styles(), nature(), box.transform(coord, size));
    }

    public Cell<C> moveTo(Coord coord) {
        return transform(coord, box.size());
    }

    public Cell<C> resize(Size size) {
        return transform(box.min(), size);
    }

    /**
     * Best-effort text of the content, used for rendering and debugging.
     *
     * <p>{@code null} gives "", a {@link Content} gives its text, an {@link Iterable} gives the
     * concatenated text of its non-null items; anything else goes through {@code String.valueOf}.
     */
    public String text() {
        return textOf(content);
    }

    private static String textOf(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence chars) {
            return chars.toString();
        }
        if (value instanceof Content node) {
            return node.text();
        }
        if (value instanceof Iterable<?> items) {
            var sb = new StringBuilder();
            for (var item : items) {
                sb.append(textOf(item));
            }
            return sb.toString();
        }
        return String.valueOf(value);
    }

    @Override
    public int compareTo(Cell<?> other) {
        return box.compareTo(other.box);
    }

    @Override
    public String toString() {
        return "Cell{content=" + content
               + ", styles=" + styles()
               + ", nature=" + nature()
               + ", box=" + box + "}";
    }

    public static final class Builder<C> {
        private final C content;
        private Map<String, String> styles;
        private String nature = BODY;
        private Coord min = Coord.ORIGIN;
        private Size size = Size.ONE;

        private Builder(C content) {
            this.content = content;
        }

        public Builder<C> styles(Map<String, String> styles) {
            this.styles = styles;
            return this;
        }

        public Builder<C> nature(String nature) {
            this.nature = nature;
            return this;
        }

        public Builder<C> at(int x, int y) {
            this.min = Coord.of(x, y);
            return this;
        }

        public Builder<C> span(int width, int height) {
            this.size = Size.of(width, height);
            return this;
        }

        public Cell<C> build() {
            return new Cell<>(content, styles, nature, Box.of(min, size));
        }
    }
}
