package org.pragmatica.table.error;

import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;

/**
 * Failure raised by the table model, with enough context to report it.
 */
public sealed interface TableError {

    /**
     * Broad category of the failure.
     */
    enum Kind {
        INVALID_BOUNDS,
        NOT_FOUND,
        COLLISION,
        EMPTY_MERGE,
        AMBIGUOUS_MERGE,
        UNSUPPORTED_CONTENT
    }

    Kind kind();

    String message();

    /**
     * Coordinates or box bounds that are not positive, or are inverted.
     */
    record InvalidBounds(
    String detail) implements TableError {
        @Override
        public Kind kind() {
            return Kind.INVALID_BOUNDS;
        }

        @Override
        public String message() {
            return "Invalid bounds: " + detail;
        }
    }

    /**
     * Malformed alphabetic label or coordinate string.
     */
    record InvalidLabel(
    String label) implements TableError {
        @Override
        public Kind kind() {
            return Kind.INVALID_BOUNDS;
        }

        @Override
        public String message() {
            return "Invalid label '" + label + "'";
        }
    }

    /**
     * No cell covers the coordinate.
     */
    record NotFound(
    Coord coord) implements TableError {
        @Override
        public Kind kind() {
            return Kind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "No cell at " + coord;
        }
    }

    /**
     * The requested box collides with a cell already in the grid.
     */
    record Collision(
    Box requested,
    Box occupied) implements TableError {
        @Override
        public Kind kind() {
            return Kind.COLLISION;
        }

        @Override
        public String message() {
            return "Cannot place cell at " + requested + ": collides with cell at " + occupied;
        }
    }

    /**
     * The merge target contains no cell.
     */
    record EmptyMerge(
    Box target) implements TableError {
        @Override
        public Kind kind() {
            return Kind.EMPTY_MERGE;
        }

        @Override
        public String message() {
            return "Nothing to merge in " + target;
        }
    }

    /**
     * A cell straddles the merge boundary.
     */
    record AmbiguousMerge(
    Box target,
    Box straddling) implements TableError {
        @Override
        public Kind kind() {
            return Kind.AMBIGUOUS_MERGE;
        }

        @Override
        public String message() {
            return "Cannot merge " + target + ": cell at " + straddling + " is only partially inside";
        }
    }

    /**
     * The content appender has no way to combine the two contents.
     */
    record UnsupportedContent(
    String leftType,
    String rightType) implements TableError {
        @Override
        public Kind kind() {
            return Kind.UNSUPPORTED_CONTENT;
        }

        @Override
        public String message() {
            return "Cannot append " + rightType + " to " + leftType + "; supply a content appender";
        }
    }
}
