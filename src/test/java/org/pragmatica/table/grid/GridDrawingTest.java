package org.pragmatica.table.grid;

import org.junit.jupiter.api.Test;
import org.pragmatica.table.cell.Cell;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GridDrawingTest {

    @Test
    void wideCellsOnBothRows() {
        var grid = new Grid<>(List.of(
            Cell.of("aaa", 1, 1, 2, 1), Cell.of("bb", 3, 1),
            Cell.of("cc", 1, 2), Cell.of("dddddddddd", 2, 2, 2, 1)));

        assertThat(grid.draw()).isEqualTo("""
            +-----------------------+-----------+
            |    aaa                |    bb     |
            +-----------+-----------------------+
            |    cc     | ddddddddd             |
            +-----------+-----------------------+""");
    }

    @Test
    void evenLengthTitles_padExtraSpaceOnTheRight() {
        var grid = new Grid<>(List.of(
            Cell.of("aaaaaa", 1, 1, 2, 1), Cell.of("bb", 3, 1),
            Cell.of("cc", 1, 2), Cell.of("dddddd", 2, 2, 2, 1)));

        assertThat(grid.draw()).isEqualTo("""
            +-----------------------+-----------+
            |  aaaaaa               |    bb     |
            +-----------+-----------------------+
            |    cc     |  dddddd               |
            +-----------+-----------------------+""");
    }

    @Test
    void singleCharacterTitle() {
        var grid = new Grid<>(List.of(
            Cell.of("aaa", 1, 1, 2, 1), Cell.of("b", 3, 1),
            Cell.of("cc", 1, 2), Cell.of("ddddd", 2, 2, 2, 1)));

        assertThat(grid.draw()).isEqualTo("""
            +-----------------------+-----------+
            |    aaa                |     b     |
            +-----------+-----------------------+
            |    cc     |   ddddd               |
            +-----------+-----------------------+""");
    }

    @Test
    void rowSpansInterleaved() {
        var grid = new Grid<>(List.of(
            Cell.of("aa", 1, 1, 1, 2), Cell.of("bbb", 2, 1, 2, 1),
            Cell.of("ccc", 2, 2, 1, 2), Cell.of("dd", 3, 2),
            Cell.of("eeee", 1, 3), Cell.of("ffffff", 3, 3)));

        assertThat(grid.draw()).isEqualTo("""
            +-----------+-----------------------+
            |    aa     |    bbb                |
            |           +-----------+-----------+
            |           |    ccc    |    dd     |
            +-----------|           +-----------+
            |   eeee    |           |  ffffff   |
            +-----------+-----------+-----------+""");
    }

    @Test
    void rowSpanAboveColumnSpan() {
        var grid = new Grid<>(List.of(
            Cell.of("aa", 1, 1, 1, 2), Cell.of("bb", 2, 1), Cell.of("cccc", 3, 1),
            Cell.of("ddd", 2, 2), Cell.of("eeeee", 3, 2),
            Cell.of("ff", 1, 3, 2, 1), Cell.of("gggggg", 3, 3)));

        assertThat(grid.draw()).isEqualTo("""
            +-----------+-----------+-----------+
            |    aa     |    bb     |   cccc    |
            |           +-----------+-----------+
            |           |    ddd    |   eeeee   |
            +-----------------------+-----------+
            |    ff                 |  gggggg   |
            +-----------------------+-----------+""");
    }

    @Test
    void unitCells() {
        var grid = new Grid<>(List.of(
            Cell.of("a", 1, 1), Cell.of("bb", 2, 1),
            Cell.of("cc", 1, 2), Cell.of("d", 2, 2)));

        assertThat(grid.draw()).isEqualTo("""
            +-----------+-----------+
            |     a     |    bb     |
            +-----------+-----------+
            |    cc     |     d     |
            +-----------+-----------+""");
    }

    @Test
    void lines_streamOneEntryPerTextLine() {
        var grid = new Grid<>(List.of(
            Cell.of("aa", 1, 1, 1, 2), Cell.of("bb", 2, 1), Cell.of("cccc", 3, 1),
            Cell.of("ddd", 2, 2), Cell.of("eeeee", 3, 2),
            Cell.of("ffffff", 1, 3, 2, 1), Cell.of("gggggg", 3, 3)));

        assertThat(grid.lines()).containsExactly(
            "+-----------+-----------+-----------+",
            "|    aa     |    bb     |   cccc    |",
            "|           +-----------+-----------+",
            "|           |    ddd    |   eeeee   |",
            "+-----------------------+-----------+",
            "|  ffffff               |  gggggg   |",
            "+-----------------------+-----------+");
    }

    @Test
    void missingCoordinates_drawnAsEmptyTiles() {
        var grid = new Grid<>(List.of(Cell.of("a", 1, 1), Cell.of("b", 2, 2)));

        assertThat(grid.draw()).isEqualTo("""
            +-----------+-----------+
            |     a     |           |
            +-----------+-----------+
            |           |     b     |
            +-----------+-----------+""");
    }

    @Test
    void emptyGrid_drawsNothing() {
        assertThat(new Grid<String>().draw()).isEmpty();
        assertThat(new Grid<String>().lines()).isEmpty();
    }

    @Test
    void customTileSet() {
        var grid = new Grid<>(List.of(Cell.of("a", 1, 1)));

        assertThat(GridDrawing.create(new TileSet('#', '=', '!')).draw(grid)).isEqualTo("""
            #===========#
            !     a     !
            #===========#""");
    }
}
