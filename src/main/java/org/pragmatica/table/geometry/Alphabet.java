package org.pragmatica.table.geometry;

import org.pragmatica.table.error.TableError;
import org.pragmatica.table.error.TableException;

/**
 * Bijective base-26 labels, the way spreadsheets name columns: 1 is "A", 26 is "Z", 27 is "AA".
 */
public final class Alphabet {
    private static final int RADIX = 26;

    private Alphabet() {}

    /**
     * Convert a non-negative integer to its label. Zero maps to the empty label.
     */
    public static String toLabel(int value) {
        if (value < 0) {
            throw new TableException(new TableError.InvalidLabel(String.valueOf(value)));
        }
        var sb = new StringBuilder();
        int rest = value;
        while (rest > 0) {
            rest--;
            sb.append((char) ('A' + rest % RADIX));
            rest /= RADIX;
        }
        return sb.reverse().toString();
    }

    /**
     * Convert a label back to its integer. The empty label maps to zero.
     *
     * @throws TableException if the label has a character outside {@code A..Z} or its value does
     *                        not fit in an {@code int}
     */
    public static int toInt(String label) {
        int value = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new TableException(new TableError.InvalidLabel(label));
            }
            try {
                value = Math.addExact(Math.multiplyExact(value, RADIX), c - 'A' + 1);
            } catch (ArithmeticException e) {
                throw new TableException(new TableError.InvalidLabel(label));
            }
        }
        return value;
    }
}
