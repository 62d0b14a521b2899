package org.pragmatica.table.grid;

import org.pragmatica.table.cell.Cell;
import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Text rendering of a grid, for debugging and test fixtures.
 *
 * <p>Example output:
 * <pre>
 * +-----------+-----------------------+
 * |    red    |   pink                |
 * |           +-----------+-----------+
 * |           |   blue    |           |
 * +-----------+-----------+-----------+
 * </pre>
 *
 * <p>Every coordinate of the bounding box is drawn as a tile 12 characters wide and 2 lines
 * high. A tile draws its left border when it is the leftmost column of its cell and its top
 * border when it is the top row of its cell; right and bottom borders only appear on the
 * edges of the grid. The cell text is centered on the tile in the middle of the cell.
 */
public final class GridDrawing {
    private static final int TITLE_WIDTH = 9;
    private static final int TILE_WIDTH = TITLE_WIDTH + 2;

    private final TileSet tiles;

    private GridDrawing(TileSet tiles) {
        this.tiles = tiles;
    }

    public static GridDrawing create() {
        return new GridDrawing(TileSet.ASCII);
    }

    public static GridDrawing create(TileSet tiles) {
        return new GridDrawing(tiles);
    }

    /**
     * Lines of the drawing, computed one grid row at a time.
     */
    public Stream<String> lines(Grid<?> grid) {
        return grid.boundingBox()
                   .map(bb -> IntStream.rangeClosed(bb.min().y(), bb.max().y())
                                       .boxed()
                                       .flatMap(row -> rowLines(grid, bb, row).stream()))
                   .orElseGet(Stream::empty);
    }

    public String draw(Grid<?> grid) {
        return lines(grid).collect(Collectors.joining("\n"));
    }

    private List<String> rowLines(Grid<?> grid, Box bb, int row) {
        var rowTiles = new ArrayList<List<String>>();
        for (int col = bb.min().x(); col <= bb.max().x(); col++) {
            var coord = Coord.of(col, row);
            var cell = grid.find(coord);
            var box = cell.map(Cell::box).orElse(Box.at(coord));
            var text = cell.map(Cell::text).orElse("");
            boolean middle = (box.min().x() + box.max().x()) / 2 == col
                             && (box.min().y() + box.max().y()) / 2 == row;
            rowTiles.add(tile(box.min().x() == col,
                              box.min().y() == row,
                              bb.max().x() == col,
                              bb.max().y() == row,
                              middle ? title(text) : " ".repeat(TITLE_WIDTH)));
        }
        var lines = new ArrayList<String>();
        int height = rowTiles.get(0).size();
        for (int i = 0; i < height; i++) {
            var sb = new StringBuilder();
            for (var tile : rowTiles) {
                sb.append(tile.get(i));
            }
            lines.add(sb.toString());
        }
        return lines;
    }

    private List<String> tile(boolean left, boolean top, boolean right, boolean bottom, String title) {
        var lines = new ArrayList<String>(3);
        lines.add(top ? border(left, right) : side(left) + " ".repeat(TILE_WIDTH) + rightSide(right));
        lines.add(side(left) + " " + title + " " + rightSide(right));
        if (bottom) {
            lines.add(border(left, right));
        }
        return lines;
    }

    private String border(boolean left, boolean right) {
        var dashes = String.valueOf(tiles.horizontal()).repeat(TILE_WIDTH);
        return (left ? tiles.corner() : tiles.horizontal()) + dashes + (right ? String.valueOf(tiles.corner()) : "");
    }

    private String side(boolean left) {
        return String.valueOf(left ? tiles.vertical() : ' ');
    }

    private String rightSide(boolean right) {
        return right ? String.valueOf(tiles.vertical()) : "";
    }

    private static String title(String text) {
        if (text.length() >= TITLE_WIDTH) {
            return text.substring(0, TITLE_WIDTH);
        }
        int padding = TITLE_WIDTH - text.length();
        int before = padding / 2;
        return " ".repeat(before) + text + " ".repeat(padding - before);
    }
}
