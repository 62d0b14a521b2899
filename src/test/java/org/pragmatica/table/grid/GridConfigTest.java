package org.pragmatica.table.grid;

import org.junit.jupiter.api.Test;
import org.pragmatica.table.geometry.Box;

import static org.junit.jupiter.api.Assertions.*;

class GridConfigTest {

    @Test
    void default_usesCornerPolicy() {
        assertEquals(CollisionPolicy.CORNERS, GridConfig.DEFAULT.collisionPolicy());
    }

    @Test
    void withCollisionPolicy_returnsNewConfig() {
        var area = GridConfig.DEFAULT.withCollisionPolicy(CollisionPolicy.AREA);

        assertEquals(CollisionPolicy.AREA, area.collisionPolicy());
        assertEquals(CollisionPolicy.CORNERS, GridConfig.DEFAULT.collisionPolicy());
    }

    @Test
    void policies_disagreeOnCrossShape() {
        var horizontal = Box.of(1, 2, 3, 2);
        var vertical = Box.of(2, 1, 2, 3);

        assertFalse(CollisionPolicy.CORNERS.collides(horizontal, vertical));
        assertTrue(CollisionPolicy.AREA.collides(horizontal, vertical));
        assertTrue(CollisionPolicy.CORNERS.collides(Box.at(1, 1), Box.of(1, 1, 2, 2)));
    }
}
