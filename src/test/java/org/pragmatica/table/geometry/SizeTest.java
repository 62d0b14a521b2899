package org.pragmatica.table.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SizeTest {

    @Test
    void arithmetic() {
        var size = Size.of(2, 3);

        assertEquals(Size.of(3, 4), size.plus(Size.ONE));
        assertEquals(Size.of(1, 2), size.minus(Size.ONE));
        assertEquals(Size.of(4, 6), size.times(2));
        assertEquals(Size.of(-2, -3), size.negate());
    }

    @Test
    void zeroAndNegative_allowedAsDeltas() {
        assertEquals(Size.of(0, -1), Size.ONE.minus(Size.of(1, 2)));
    }

    @Test
    void toString_showsBothDimensions() {
        assertEquals("(2 x 3)", Size.of(2, 3).toString());
    }
}
