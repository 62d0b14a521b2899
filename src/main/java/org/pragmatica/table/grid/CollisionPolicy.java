package org.pragmatica.table.grid;

import org.pragmatica.table.geometry.Box;

/**
 * How the grid decides that two cell boxes collide.
 */
public enum CollisionPolicy {
    /**
     * A corner of either box lies inside the other ({@link Box#intersect(Box)}).
     * Compatible with existing converters; a cell crossing another one edge to edge is not detected.
     */
    CORNERS {
        @Override
        public boolean collides(Box first, Box second) {
            return first.intersect(second);
        }
    },

    /**
     * The boxes share at least one cell ({@link Box#overlaps(Box)}).
     */
    AREA {
        @Override
        public boolean collides(Box first, Box second) {
            return first.overlaps(second);
        }
    };

    public abstract boolean collides(Box first, Box second);
}
