package org.pragmatica.table.table;

import org.pragmatica.table.cell.Cell;
import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;

import java.util.Map;

/**
 * View on the cells of a table column. Owned cells come top to bottom.
 */
public final class ColView<C> extends TableView<C> {

    ColView(Table<C> table, int pos, Map<String, String> styles, String nature) {
        super(table, pos, styles, nature);
    }

    @Override
    public boolean canOwn(Cell<?> cell) {
        return cell.min().x() == pos();
    }

    @Override
    public boolean canCatch(Cell<?> cell) {
        return cell.min().x() <= pos() && pos() <= cell.max().x();
    }

    @Override
    protected Coord slot(int index) {
        return Coord.of(pos(), index);
    }

    @Override
    protected int reach(Box box) {
        return box.max().y();
    }

    @Override
    public String toString() {
        return "ColView{pos=" + pos() + ", nature=" + nature() + ", styles=" + styles() + "}";
    }
}
