package org.pragmatica.table.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.table.geometry.Box;
import org.pragmatica.table.geometry.Coord;

import static org.assertj.core.api.Assertions.assertThat;

class TableErrorTest {

    @Test
    void messages_nameTheBoxesInvolved() {
        assertThat(new TableError.NotFound(Coord.of(3, 3)).message()).isEqualTo("No cell at C3");
        assertThat(new TableError.Collision(Box.of(1, 2, 2, 2), Box.of(1, 1, 1, 2)).message())
            .isEqualTo("Cannot place cell at A2:B2: collides with cell at A1:A2");
        assertThat(new TableError.EmptyMerge(Box.of(4, 4, 5, 5)).message()).isEqualTo("Nothing to merge in D4:E5");
        assertThat(new TableError.AmbiguousMerge(Box.of(1, 1, 2, 2), Box.of(2, 1, 3, 1)).message())
            .contains("A1:B2", "B1:C1");
    }

    @Test
    void kinds_groupLabelAndBoundsFailures() {
        assertThat(new TableError.InvalidLabel("a1").kind()).isEqualTo(TableError.Kind.INVALID_BOUNDS);
        assertThat(new TableError.InvalidBounds("x").kind()).isEqualTo(TableError.Kind.INVALID_BOUNDS);
        assertThat(new TableError.UnsupportedContent("A", "B").kind()).isEqualTo(TableError.Kind.UNSUPPORTED_CONTENT);
    }

    @Test
    void exception_carriesErrorAndMessage() {
        var error = new TableError.EmptyMerge(Box.at(1, 1));
        var exception = new TableException(error);

        assertThat(exception.error()).isSameAs(error);
        assertThat(exception.kind()).isEqualTo(TableError.Kind.EMPTY_MERGE);
        assertThat(exception).hasMessage("Nothing to merge in A1");
    }
}
