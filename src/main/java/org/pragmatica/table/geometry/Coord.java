package org.pragmatica.table.geometry;

import org.pragmatica.table.error.TableError;
import org.pragmatica.table.error.TableException;

import java.util.regex.Pattern;

/**
 * A cell position in a grid (column x and row y, both 1-based).
 *
 * <p>Ordered row first, so sorting coordinates walks the grid row by row.
 */
public record Coord(int x, int y) implements Comparable<Coord> {

    public static final Coord ORIGIN = new Coord(1, 1);

    private static final Pattern LABEL = Pattern.compile("([A-Z]+)([0-9]+)");

    public Coord {
        if (x < 1 || y < 1) {
            throw new TableException(new TableError.InvalidBounds("coordinate (" + x + ", " + y + ")"));
        }
    }

    public static Coord of(int x, int y) {
        return new Coord(x, y);
    }

    /**
     * Parse the spreadsheet form, e.g. "E6".
     */
    public static Coord parse(String label) {
        var matcher = LABEL.matcher(label);
        if (!matcher.matches()) {
            throw new TableException(new TableError.InvalidLabel(label));
        }
        try {
            return new Coord(Alphabet.toInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new TableException(new TableError.InvalidLabel(label));
        }
    }

    public Coord plus(Size size) {
        return new Coord(x + size.width(), y + size.height());
    }

    public Coord minus(Size size) {
        return new Coord(x - size.width(), y - size.height());
    }

    @Override
    public int compareTo(Coord other) {
        return y != other.y
               ? Integer.compare(y, other.y)
               : Integer.compare(x, other.x);
    }

    @Override
    public String toString() {
        return Alphabet.toLabel(x) + y;
    }
}
