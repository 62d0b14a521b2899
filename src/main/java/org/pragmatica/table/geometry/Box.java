package org.pragmatica.table.geometry;

import com.google.common.collect.ComparisonChain;
import org.pragmatica.table.error.TableError;
import org.pragmatica.table.error.TableException;

/**
 * A rectangular area of the grid, from the top-left {@code min} corner to the
 * bottom-right {@code max} corner (both inclusive).
 *
 * <p>Boxes are ordered by {@code (min.y, min.x, max.y, max.x)}, which sorts them row by row.
 */
public record Box(Coord min, Coord max) implements Comparable<Box> {

    public Box {
        if (min.x() > max.x() || min.y() > max.y()) {
            throw new TableException(new TableError.InvalidBounds("box from " + min + " to " + max));
        }
    }

    /**
     * Box from its top-left and bottom-right corners.
     */
    public static Box of(Coord min, Coord max) {
        return new Box(min, max);
    }

    /**
     * Box from its top-left corner and its size.
     */
    public static Box of(Coord min, Size size) {
        if (size.width() < 1 || size.height() < 1) {
            throw new TableException(new TableError.InvalidBounds("box at " + min + " of size " + size));
        }
        return new Box(min, min.plus(size).minus(Size.ONE));
    }

    public static Box of(int minX, int minY, int maxX, int maxY) {
        return new Box(new Coord(minX, minY), new Coord(maxX, maxY));
    }

    /**
     * Single-cell box.
     */
    public static Box at(Coord coord) {
        return new Box(coord, coord);
    }

    public static Box at(int x, int y) {
        return at(new Coord(x, y));
    }

    /**
     * Boxes are immutable, so a copy is the box itself.
     */
    public static Box copyOf(Box other) {
        return other;
    }

    /**
     * Parse the spreadsheet form, e.g. "E6:G8" or "E6".
     */
    public static Box parse(String label) {
        int colon = label.indexOf(':');
        return colon < 0
               ? at(Coord.parse(label))
               : of(Coord.parse(label.substring(0, colon)), Coord.parse(label.substring(colon + 1)));
    }

    public int width() {
        return max.x() - min.x() + 1;
    }

    public int height() {
        return max.y() - min.y() + 1;
    }

    public Size size() {
        return new Size(width(), height());
    }

    public boolean contains(Coord coord) {
        return min.x() <= coord.x() && coord.x() <= max.x()
               && min.y() <= coord.y() && coord.y() <= max.y();
    }

    /**
     * Both corners of {@code other} lie inside this box.
     */
    public boolean contains(Box other) {
        return contains(other.min) && contains(other.max);
    }

    /**
     * Corner test: a corner of either box lies inside the other.
     *
     * <p>Two boxes crossing each other like a plus sign share cells without any corner
     * inside the other box, so this returns {@code false} for them. Use {@link #overlaps(Box)}
     * when any shared cell counts.
     */
    public boolean intersect(Box other) {
        return contains(other.min) || contains(other.max)
               || other.contains(min) || other.contains(max);
    }

    /**
     * Area test: the two boxes share at least one cell.
     */
    public boolean overlaps(Box other) {
        return min.x() <= other.max.x() && other.min.x() <= max.x()
               && min.y() <= other.max.y() && other.min.y() <= max.y();
    }

    public boolean isDisjoint(Box other) {
        return !intersect(other);
    }

    /**
     * Bounding box of this box and all the others.
     */
    public Box union(Box... others) {
        int minX = min.x();
        int minY = min.y();
        int maxX = max.x();
        int maxY = max.y();
        for (var box : others) {
            minX = Math.min(minX, box.min.x());
            minY = Math.min(minY, box.min.y());
            maxX = Math.max(maxX, box.max.x());
            maxY = Math.max(maxY, box.max.y());
        }
        return of(minX, minY, maxX, maxY);
    }

    /**
     * Area shared by this box and all the others.
     *
     * @throws TableException if the boxes have no cell in common
     */
    public Box intersection(Box... others) {
        int minX = min.x();
        int minY = min.y();
        int maxX = max.x();
        int maxY = max.y();
        for (var box : others) {
            minX = Math.max(minX, box.min.x());
            minY = Math.max(minY, box.min.y());
            maxX = Math.min(maxX, box.max.x());
            maxY = Math.min(maxY, box.max.y());
        }
        if (minX > maxX || minY > maxY) {
            throw new TableException(new TableError.InvalidBounds("disjoint boxes have no intersection"));
        }
        return of(minX, minY, maxX, maxY);
    }

    public Box transform(Coord target, Size size) {
        return of(target, size);
    }

    public Box moveTo(Coord target) {
        return of(target, size());
    }

    public Box resize(Size size) {
        return of(min, size);
    }

    @Override
    public int compareTo(Box other) {
        return ComparisonChain.start()
                              .compare(min.y(), other.min.y())
                              .compare(min.x(), other.min.x())
                              .compare(max.y(), other.max.y())
                              .compare(max.x(), other.max.x())
                              .result();
    }

    @Override
    public String toString() {
        return width() == 1 && height() == 1
               ? min.toString()
               : min + ":" + max;
    }
}
