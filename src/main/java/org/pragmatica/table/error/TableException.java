package org.pragmatica.table.error;

/**
 * Unchecked carrier of a {@link TableError}.
 *
 * <p>The table model never catches it: operations validate before they mutate, so a
 * grid or table is left exactly as it was when this is thrown.
 */
public final class TableException extends RuntimeException {
    private final TableError error;

    public TableException(TableError error) {
        super(error.message());
        this.error = error;
    }

    public TableError error() {
        return error;
    }

    public TableError.Kind kind() {
        return error.kind();
    }
}
