package org.pragmatica.table.table;

import org.pragmatica.table.cell.Cell;
import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;

import java.util.Map;

/**
 * View on the cells of a table row. Owned cells come left to right.
 */
public final class RowView<C> extends TableView<C> {

    RowView(Table<C> table, int pos, Map<String, String> styles, String nature) {
        super(table, pos, styles, nature);
    }

    @Override
    public boolean canOwn(Cell<?> cell) {
        return cell.min().y() == pos();
    }

    @Override
    public boolean canCatch(Cell<?> cell) {
        return cell.min().y() <= pos() && pos() <= cell.max().y();
    }

    @Override
    protected Coord slot(int index) {
        return Coord.of(index, pos());
    }

    @Override
    protected int reach(Box box) {
        return box.max().x();
    }

    @Override
    public String toString() {
        return "RowView{pos=" + pos() + ", nature=" + nature() + ", styles=" + styles() + "}";
    }
}
