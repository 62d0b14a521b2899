package org.pragmatica.table.grid;

import com.google.common.collect.ImmutableList;
import org.pragmatica.table.cell.Cell;
import org.pragmatica.table.cell.ContentAppenders;
import org.pragmatica.table.error.TableError;
import org.pragmatica.table.error.TableException;
import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;
import org.pragmatica.table.geometry.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Collection of cells laid out in rows and columns, no two of them colliding.
 *
 * <p>Cells are kept sorted in {@link Box} order, so iteration walks the grid row by row.
 * Every mutating operation checks everything before it changes anything: when it throws a
 * {@link TableException} the grid is unchanged.
 *
 * <p>Example:
 * <pre>{@code
 * var grid = new Grid<String>();
 * grid.set(Coord.of(1, 1), Cell.of("red", 1, 1, 1, 2));
 * grid.set(Coord.of(2, 1), Cell.of("pink", 1, 1, 2, 1));
 * grid.set(Coord.of(2, 2), Cell.of("blue"));
 * grid.expand(Coord.of(2, 2), 1, 0);
 * }</pre>
 *
 * <p>Not thread-safe.
 *
 * @param <C> content type
 */
public final class Grid<C> implements Iterable<Cell<C>> {
    private static final Logger LOG = LoggerFactory.getLogger(Grid.class);

    private final GridConfig config;
    private final List<Cell<C>> cells = new ArrayList<>();

    public Grid() {
        this(List.of(), GridConfig.DEFAULT);
    }

    public Grid(GridConfig config) {
        this(List.of(), config);
    }

    public Grid(Iterable<Cell<C>> cells) {
        this(cells, GridConfig.DEFAULT);
    }

    /**
     * Build a grid from cells that must not collide with each other.
     *
     * @throws TableException if a cell collides with a previous one
     */
    public Grid(Iterable<Cell<C>> cells, GridConfig config) {
        this.config = checkNotNull(config, "config");
        for (var cell : cells) {
            put(cell);
        }
    }

    public GridConfig config() {
        return config;
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public boolean contains(Coord coord) {
        return find(coord).isPresent();
    }

    /**
     * The cell covering {@code coord}.
     */
    public Optional<Cell<C>> find(Coord coord) {
        for (var cell : cells) {
            if (cell.contains(coord)) {
                return Optional.of(cell);
            }
        }
        return Optional.empty();
    }

    /**
     * The cell covering {@code coord}.
     *
     * @throws TableException ({@link TableError.NotFound}) if no cell covers it
     */
    public Cell<C> get(Coord coord) {
        return find(coord).orElseThrow(() -> new TableException(new TableError.NotFound(coord)));
    }

    /**
     * Place a copy of {@code cell} with its top-left corner at {@code coord}.
     *
     * @return the copy actually stored in the grid
     * @throws TableException ({@link TableError.Collision}) if it collides with a cell of the grid
     */
    public Cell<C> set(Coord coord, Cell<C> cell) {
        var placed = cell.moveTo(coord);
        for (var existing : cells) {
            if (config.collisionPolicy().collides(existing.box(), placed.box())) {
                throw new TableException(new TableError.Collision(placed.box(), existing.box()));
            }
        }
        insertSorted(placed);
        LOG.debug("Inserted cell at {}", placed.box());
        return placed;
    }

    /**
     * Place the cell where its box says.
     */
    public Cell<C> put(Cell<C> cell) {
        return set(cell.min(), cell);
    }

    /**
     * Remove the cell covering {@code coord}.
     *
     * @return the removed cell
     * @throws TableException ({@link TableError.NotFound}) if no cell covers it
     */
    public Cell<C> delete(Coord coord) {
        var cell = get(coord);
        cells.remove(cell);
        LOG.debug("Deleted cell at {}", cell.box());
        return cell;
    }

    /**
     * Merge with the default content appender, see {@link ContentAppenders#natural()}.
     */
    public Cell<C> merge(Coord start, Coord end) {
        return merge(start, end, ContentAppenders.natural());
    }

    /**
     * Replace the cells inside the box {@code start:end} by a single cell spanning the box.
     *
     * <p>Contents are combined from left to right in grid order with {@code appender}. Styles are
     * merged into those of the first cell, later values winning. The first cell's nature is kept.
     *
     * @return the merged cell
     * @throws TableException ({@link TableError.AmbiguousMerge}) if a cell is only partly inside
     *                        the box, ({@link TableError.EmptyMerge}) if no cell is inside it
     */
    public Cell<C> merge(Coord start, Coord end, BinaryOperator<C> appender) {
        return mergeInto(Box.of(start, end), null, appender);
    }

    public Cell<C> expand(Coord coord, int width, int height) {
        return expand(coord, width, height, ContentAppenders.natural());
    }

    /**
     * Grow the cell covering {@code coord} by merging it with the cells of the enlarged box.
     * Negative deltas shrink it; the freed coordinates are left empty.
     *
     * @return the expanded cell
     * @throws TableException if no cell covers {@code coord}, if the new box is invalid, or if the
     *                        merge fails
     */
    public Cell<C> expand(Coord coord, int width, int height, BinaryOperator<C> appender) {
        var anchor = get(coord);
        var delta = Size.of(width, height);
        var target = Box.of(anchor.min(), anchor.max().plus(delta));
        LOG.debug("Expanding cell at {} by {}", anchor.box(), delta);
        return mergeInto(target, anchor, appender);
    }

    /**
     * Smallest box containing every cell, empty for an empty grid.
     */
    public Optional<Box> boundingBox() {
        if (cells.isEmpty()) {
            return Optional.empty();
        }
        var first = cells.get(0).box();
        var others = cells.stream()
                          .skip(1)
                          .map(Cell::box)
                          .toArray(Box[]::new);
        return Optional.of(first.union(others));
    }

    /**
     * Cells grouped by the row of their top-left corner, in grid order.
     */
    public List<List<Cell<C>>> rows() {
        var rows = new ArrayList<List<Cell<C>>>();
        var current = new ArrayList<Cell<C>>();
        for (var cell : cells) {
            if (!current.isEmpty() && current.get(0).min().y() != cell.min().y()) {
                rows.add(List.copyOf(current));
                current.clear();
            }
            current.add(cell);
        }
        if (!current.isEmpty()) {
            rows.add(List.copyOf(current));
        }
        return rows;
    }

    /**
     * Snapshot of the cells in grid order.
     */
    public List<Cell<C>> cells() {
        return ImmutableList.copyOf(cells);
    }

    @Override
    public Iterator<Cell<C>> iterator() {
        return Collections.unmodifiableList(cells).iterator();
    }

    public Stream<String> lines() {
        return GridDrawing.create().lines(this);
    }

    public String draw() {
        return GridDrawing.create().draw(this);
    }

    @Override
    public String toString() {
        return draw();
    }

    /**
     * Replace the cells inside {@code target} by one cell spanning it. The {@code anchor}, when
     * given, always takes part in the merge even if it sticks out of the target.
     */
    private Cell<C> mergeInto(Box target, Cell<C> anchor, BinaryOperator<C> appender) {
        var merged = new ArrayList<Cell<C>>();
        var kept = new ArrayList<Cell<C>>();
        for (var cell : cells) {
            if (cell == anchor || target.contains(cell.box())) {
                merged.add(cell);
            } else if (config.collisionPolicy().collides(cell.box(), target)) {
                throw new TableException(new TableError.AmbiguousMerge(target, cell.box()));
            } else {
                kept.add(cell);
            }
        }
        if (merged.isEmpty()) {
            throw new TableException(new TableError.EmptyMerge(target));
        }
        var result = merged.get(0).transform(target.min(), target.size());
        var content = result.content();
        for (var cell : merged.subList(1, merged.size())) {
            content = appender.apply(content, cell.content());
            result.styles().putAll(cell.styles());
        }
        result.setContent(content);

        cells.clear();
        cells.addAll(kept);
        insertSorted(result);
        LOG.debug("Merged {} cell(s) into {}", merged.size(), target);
        return result;
    }

    private void insertSorted(Cell<C> cell) {
        int index = Collections.binarySearch(cells, cell);
        cells.add(index < 0 ? -index - 1 : index, cell);
    }
}
