package org.pragmatica.table;

import org.pragmatica.table.cell.Cell;
import org.pragmatica.table.cell.Styled;
import org.pragmatica.table.grid.CollisionPolicy;
import org.pragmatica.table.grid.GridConfig;
import org.pragmatica.table.table.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for building tables.
 */
public final class Tables {
    private Tables() {}

    public static <C> Table<C> empty() {
        return new Table<>();
    }

    /**
     * Table of the given cells, each placed where its box says.
     *
     * @throws org.pragmatica.table.error.TableException if two cells collide
     */
    @SafeVarargs
    public static <C> Table<C> of(Cell<C>... cells) {
        return new Table<>(Arrays.asList(cells));
    }

    public static <C> Table<C> of(Iterable<Cell<C>> cells) {
        return new Table<>(cells);
    }

    /**
     * Create a builder for tables with styles, a nature or a non-default collision policy.
     */
    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public static final class Builder<C> {
        private final List<Cell<C>> cells = new ArrayList<>();
        private final Map<String, String> styles = new LinkedHashMap<>();
        private String nature = Styled.BODY;
        private CollisionPolicy collisionPolicy = GridConfig.DEFAULT.collisionPolicy();

        private Builder() {}

        public Builder<C> cells(Iterable<Cell<C>> cells) {
            cells.forEach(this.cells::add);
            return this;
        }

        public Builder<C> cell(Cell<C> cell) {
            cells.add(cell);
            return this;
        }

        public Builder<C> styles(Map<String, String> styles) {
            this.styles.putAll(styles);
            return this;
        }

        public Builder<C> style(String name, String value) {
            styles.put(name, value);
            return this;
        }

        public Builder<C> nature(String nature) {
            this.nature = nature;
            return this;
        }

        public Builder<C> collisionPolicy(CollisionPolicy policy) {
            this.collisionPolicy = policy;
            return this;
        }

        public Table<C> build() {
            var config = GridConfig.DEFAULT.withCollisionPolicy(collisionPolicy);
            return new Table<>(cells, styles, nature, config);
        }
    }
}
