package org.pragmatica.table.table;

import com.google.common.collect.ImmutableList;
import org.pragmatica.table.cell.Cell;
import org.pragmatica.table.cell.Styled;
import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;
import org.pragmatica.table.geometry.Size;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * View on the cells of one row or one column of a {@link Table}.
 *
 * <p>A view <em>owns</em> the cells whose top-left corner is on its row (column) and
 * <em>catches</em> every cell passing through it, owned or spanning in from elsewhere.
 * Both lists are kept in grid order.
 *
 * <p>Views belong to their table, which refills them after every change. A view obtained before
 * a merge, an expansion or a deletion may be discarded by the table; get it again from
 * {@link Table#rows()} or {@link Table#cols()}.
 *
 * @param <C> content type
 */
public abstract sealed class TableView<C> extends Styled permits RowView, ColView {
    private final Table<C> table;
    private final int pos;
    private final List<Cell<C>> ownedCells = new ArrayList<>();
    private final List<Cell<C>> caughtCells = new ArrayList<>();

    TableView(Table<C> table, int pos, Map<String, String> styles, String nature) {
        super(styles, nature);
        this.table = table;
        this.pos = pos;
    }

    public Table<C> table() {
        return table;
    }

    /**
     * Row or column position in the table (1-based).
     */
    public int pos() {
        return pos;
    }

    public List<Cell<C>> ownedCells() {
        return ImmutableList.copyOf(ownedCells);
    }

    public List<Cell<C>> caughtCells() {
        return ImmutableList.copyOf(caughtCells);
    }

    /**
     * The cell's top-left corner is on this view.
     */
    public abstract boolean canOwn(Cell<?> cell);

    /**
     * The cell passes through this view.
     */
    public abstract boolean canCatch(Cell<?> cell);

    /**
     * Coordinate of this view at {@code index} along its axis.
     */
    protected abstract Coord slot(int index);

    /**
     * Last index along this view's axis covered by {@code box}.
     */
    protected abstract int reach(Box box);

    public Cell<C> insertCell(C content) {
        return insertCell(content, null, null, 1, 1);
    }

    public Cell<C> insertCell(C content, int width, int height) {
        return insertCell(content, null, null, width, height);
    }

    /**
     * Insert a new cell at the first slot of this view not covered by a caught cell, or after the
     * last one. Spans coming from previous rows (columns) are skipped.
     *
     * @param nature nature of the new cell, {@code null} for the nature of this view
     * @return the inserted cell
     * @throws org.pragmatica.table.error.TableException if the new cell collides with another one
     */
    public Cell<C> insertCell(C content, Map<String, String> styles, String nature, int width, int height) {
        var box = Box.of(slot(nextFreeIndex()), Size.of(width, height));
        var cell = new Cell<>(content, styles, nature == null ? nature() : nature, box);
        return table.put(cell);
    }

    private int nextFreeIndex() {
        if (caughtCells.isEmpty()) {
            return 1;
        }
        int limit = caughtCells.stream()
                               .mapToInt(cell -> reach(cell.box()))
                               .max()
                               .orElse(0);
        for (int index = 1; index <= limit; index++) {
            var coord = slot(index);
            if (caughtCells.stream().noneMatch(cell -> cell.contains(coord))) {
                return index;
            }
        }
        return limit + 1;
    }

    void adopt(Cell<C> cell) {
        if (canOwn(cell)) {
            insertSorted(ownedCells, cell);
        }
        if (canCatch(cell)) {
            insertSorted(caughtCells, cell);
        }
    }

    void clear() {
        ownedCells.clear();
        caughtCells.clear();
    }

    private static <C> void insertSorted(List<Cell<C>> cells, Cell<C> cell) {
        int index = Collections.binarySearch(cells, cell);
        cells.add(index < 0 ? -index - 1 : index, cell);
    }
}
