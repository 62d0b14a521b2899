package org.pragmatica.table.table;

import com.google.common.collect.ImmutableList;
import org.pragmatica.table.cell.Cell;
import org.pragmatica.table.cell.Styled;
import org.pragmatica.table.error.TableError;
import org.pragmatica.table.error.TableException;
import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;
import org.pragmatica.table.grid.Grid;
import org.pragmatica.table.grid.GridConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.IntFunction;
import java.util.stream.Stream;

/**
 * Styled grid with row and column views, the structure format converters fill and read.
 *
 * <p>A parser typically streams cells in row by row:
 * <pre>{@code
 * var table = new Table<String>();
 * table.row(1).insertCell("one");
 * table.row(1).insertCell("spanned", 1, 2);
 * table.row(2).insertCell("two");
 * }</pre>
 *
 * <p>Inserting a cell updates the views in place. Deleting, merging or expanding rebuilds them:
 * views inside the new bounding box keep their styles and nature, the others are discarded.
 * Do not hold on to a view across such an operation.
 *
 * <p>Not thread-safe.
 *
 * @param <C> content type
 */
public final class Table<C> extends Styled implements Iterable<Cell<C>> {
    private static final Logger LOG = LoggerFactory.getLogger(Table.class);

    private final Grid<C> grid;
    private final List<RowView<C>> rows = new ArrayList<>();
    private final List<ColView<C>> cols = new ArrayList<>();
    private boolean stale = true;

    public Table() {
        this(List.of(), null, BODY, GridConfig.DEFAULT);
    }

    public Table(Iterable<Cell<C>> cells) {
        this(cells, null, BODY, GridConfig.DEFAULT);
    }

    public Table(Iterable<Cell<C>> cells, Map<String, String> styles, String nature) {
        this(cells, styles, nature, GridConfig.DEFAULT);
    }

    /**
     * @throws TableException if two of the cells collide
     */
    public Table(Iterable<Cell<C>> cells, Map<String, String> styles, String nature, GridConfig config) {
        super(styles, nature);
        this.grid = new Grid<>(cells, config);
        ensureFresh();
    }

    public GridConfig config() {
        return grid.config();
    }

    public int size() {
        return grid.size();
    }

    public boolean isEmpty() {
        return grid.isEmpty();
    }

    public boolean contains(Coord coord) {
        return grid.contains(coord);
    }

    public Optional<Cell<C>> find(Coord coord) {
        return grid.find(coord);
    }

    public Cell<C> get(Coord coord) {
        return grid.get(coord);
    }

    public Optional<Box> boundingBox() {
        return grid.boundingBox();
    }

    public List<Cell<C>> cells() {
        return grid.cells();
    }

    @Override
    public Iterator<Cell<C>> iterator() {
        return grid.iterator();
    }

    /**
     * Place a copy of {@code cell} at {@code coord} and register it in the views it crosses.
     *
     * @see Grid#set(Coord, Cell)
     */
    public Cell<C> set(Coord coord, Cell<C> cell) {
        var placed = grid.set(coord, cell);
        if (stale) {
            ensureFresh();
        } else {
            adoptCell(placed);
        }
        return placed;
    }

    public Cell<C> put(Cell<C> cell) {
        return set(cell.min(), cell);
    }

    public Cell<C> delete(Coord coord) {
        var removed = grid.delete(coord);
        invalidate();
        ensureFresh();
        return removed;
    }

    public Cell<C> merge(Coord start, Coord end) {
        var merged = grid.merge(start, end);
        invalidate();
        ensureFresh();
        return merged;
    }

    public Cell<C> merge(Coord start, Coord end, BinaryOperator<C> appender) {
        var merged = grid.merge(start, end, appender);
        invalidate();
        ensureFresh();
        return merged;
    }

    public Cell<C> expand(Coord coord, int width, int height) {
        var expanded = grid.expand(coord, width, height);
        invalidate();
        ensureFresh();
        return expanded;
    }

    public Cell<C> expand(Coord coord, int width, int height, BinaryOperator<C> appender) {
        var expanded = grid.expand(coord, width, height, appender);
        invalidate();
        ensureFresh();
        return expanded;
    }

    public void fillMissing(Box box, C placeholder) {
        fillMissing(box, placeholder, null);
    }

    /**
     * Put a 1x1 cell holding {@code placeholder} on every coordinate of {@code box} no cell covers.
     * The same placeholder reference is shared by all the new cells.
     *
     * @param nature nature of the new cells, {@code null} for the nature of their row
     */
    public void fillMissing(Box box, C placeholder, String nature) {
        int filled = 0;
        for (int y = box.min().y(); y <= box.max().y(); y++) {
            for (int x = box.min().x(); x <= box.max().x(); x++) {
                var coord = Coord.of(x, y);
                if (grid.contains(coord)) {
                    continue;
                }
                var cellNature = nature == null ? row(y).nature() : nature;
                set(coord, new Cell<>(placeholder, null, cellNature, Box.at(coord)));
                filled++;
            }
        }
        LOG.debug("Filled {} missing cell(s) in {}", filled, box);
    }

    /**
     * Current row views, from row 1 to the bottom of the bounding box.
     */
    public List<RowView<C>> rows() {
        ensureFresh();
        return ImmutableList.copyOf(rows);
    }

    /**
     * Current column views, from column 1 to the right of the bounding box.
     */
    public List<ColView<C>> cols() {
        ensureFresh();
        return ImmutableList.copyOf(cols);
    }

    /**
     * The view of row {@code pos}, created with the views before it when past the last row.
     */
    public RowView<C> row(int pos) {
        checkPosition("row", pos);
        ensureFresh();
        fit(rows, pos, this::newRow);
        return rows.get(pos - 1);
    }

    /**
     * The view of column {@code pos}, created with the views before it when past the last column.
     */
    public ColView<C> col(int pos) {
        checkPosition("column", pos);
        ensureFresh();
        fit(cols, pos, this::newCol);
        return cols.get(pos - 1);
    }

    /**
     * Rebuild every view from the cells of the grid.
     */
    public void refreshAll() {
        var extent = grid.boundingBox().map(Box::max).orElse(null);
        int height = extent == null ? 0 : extent.y();
        int width = extent == null ? 0 : extent.x();
        truncate(rows, height);
        truncate(cols, width);
        fit(rows, height, this::newRow);
        fit(cols, width, this::newCol);
        rows.forEach(TableView::clear);
        cols.forEach(TableView::clear);
        stale = false;
        grid.forEach(this::adoptCell);
        LOG.debug("Refreshed {} row view(s) and {} column view(s)", rows.size(), cols.size());
    }

    public Stream<String> lines() {
        return grid.lines();
    }

    public String draw() {
        return grid.draw();
    }

    @Override
    public String toString() {
        return draw();
    }

    private void invalidate() {
        stale = true;
    }

    private void ensureFresh() {
        if (stale) {
            refreshAll();
        }
    }

    private void adoptCell(Cell<C> cell) {
        fit(rows, cell.max().y(), this::newRow);
        fit(cols, cell.max().x(), this::newCol);
        for (int y = cell.min().y(); y <= cell.max().y(); y++) {
            rows.get(y - 1).adopt(cell);
        }
        for (int x = cell.min().x(); x <= cell.max().x(); x++) {
            cols.get(x - 1).adopt(cell);
        }
        LOG.trace("Adopted cell at {}", cell.box());
    }

    private RowView<C> newRow(int pos) {
        return new RowView<>(this, pos, null, nature());
    }

    private ColView<C> newCol(int pos) {
        return new ColView<>(this, pos, null, nature());
    }

    private static <V> void fit(List<V> views, int size, IntFunction<V> factory) {
        for (int index = views.size() + 1; index <= size; index++) {
            views.add(factory.apply(index));
        }
    }

    private static void truncate(List<?> views, int size) {
        if (views.size() > size) {
            views.subList(size, views.size()).clear();
        }
    }

    private static void checkPosition(String axis, int pos) {
        if (pos < 1) {
            throw new TableException(new TableError.InvalidBounds(axis + " position " + pos + " must be at least 1"));
        }
    }
}
