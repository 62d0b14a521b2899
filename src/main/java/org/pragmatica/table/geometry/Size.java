package org.pragmatica.table.geometry;

/**
 * Width (spanned columns) and height (spanned rows) of a cell.
 *
 * <p>Zero and negative sizes are allowed as intermediate values, for example a delta that
 * shrinks a cell. Boxes and cells never have them.
 */
public record Size(int width, int height) {

    public static final Size ONE = new Size(1, 1);

    public static Size of(int width, int height) {
        return new Size(width, height);
    }

    public Size plus(Size other) {
        return new Size(width + other.width, height + other.height);
    }

    public Size minus(Size other) {
        return new Size(width - other.width, height - other.height);
    }

    public Size times(int factor) {
        return new Size(width * factor, height * factor);
    }

    public Size negate() {
        return new Size(-width, -height);
    }

    @Override
    public String toString() {
        return "(" + width + " x " + height + ")";
    }
}
