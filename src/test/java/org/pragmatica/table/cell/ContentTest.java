package org.pragmatica.table.cell;

import org.junit.jupiter.api.Test;
import org.pragmatica.table.geometry.Coord;
import org.pragmatica.table.grid.Grid;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTest {

    @Test
    void of_emptyString_isEmpty() {
        assertThat(Content.of("")).isSameAs(Content.EMPTY);
        assertThat(Content.of("a")).isEqualTo(new Content.Text("a"));
    }

    @Test
    void append_joinsAdjacentText() {
        var merged = Content.of("A").append(Content.of("B")).append(Content.of("C"));

        assertThat(merged).isEqualTo(new Content.Text("ABC"));
    }

    @Test
    void append_emptyIsNeutral() {
        var text = Content.of("x");

        assertThat(Content.EMPTY.append(text)).isEqualTo(text);
        assertThat(text.append(Content.EMPTY)).isEqualTo(text);
        assertThat(Content.EMPTY.append(Content.EMPTY)).isEqualTo(Content.EMPTY);
    }

    @Test
    void append_keepsMarkupAsSeparateNode() {
        var bold = Content.markup("b", Map.of(), List.of(Content.of("bold")));

        var merged = Content.of("plain ").append(bold).append(Content.of(" end"));

        assertThat(merged).isInstanceOf(Content.Nodes.class);
        assertThat(((Content.Nodes) merged).items())
            .containsExactly(new Content.Text("plain "), bold, new Content.Text(" end"));
        assertThat(merged.text()).isEqualTo("plain bold end");
    }

    @Test
    void append_isAssociative() {
        var a = Content.of("a");
        var b = Content.markup("i", Map.of(), List.of(Content.of("b")));
        var c = Content.of("c");

        assertThat(a.append(b).append(c)).isEqualTo(a.append(b.append(c)));
    }

    @Test
    void nodes_flattensNestedLists() {
        var inner = Content.nodes(List.of(Content.markup("p", Map.of(), List.of()), Content.of("x")));

        var outer = Content.nodes(List.of(Content.of("w"), inner, Content.of("y")));

        assertThat(((Content.Nodes) outer).items()).hasSize(3);
        assertThat(outer.text()).isEqualTo("wxy");
    }

    @Test
    void markup_copiesItsParts() {
        var markup = new Content.Markup("a", Map.of("href", "#"), List.of(Content.of("link")));

        assertThat(markup.attributes()).containsEntry("href", "#");
        assertThat(markup.text()).isEqualTo("link");
    }

    @Test
    void appender_mergesGridCells() {
        var grid = new Grid<>(List.of(Cell.of(Content.of("Total "), 1, 1),
                                      Cell.of(Content.markup("b", Map.of(), List.of(Content.of("42"))), 2, 1)));

        var merged = grid.merge(Coord.of(1, 1), Coord.of(2, 1), Content.APPENDER);

        assertThat(merged.content().text()).isEqualTo("Total 42");
        assertThat(merged.text()).isEqualTo("Total 42");
    }

    @Test
    void append_nullIsEmpty() {
        assertThat(Content.of("a").append(null)).isEqualTo(Content.of("a"));
        assertThat(Content.APPENDER.apply(null, Content.of("b"))).isEqualTo(Content.of("b"));
        assertThat(Content.APPENDER.apply(Content.of("a"), null)).isEqualTo(Content.of("a"));
        assertThat(Content.APPENDER.apply(null, null)).isNull();
    }

    @Test
    void appender_mergesCellsWithoutContent() {
        var grid = new Grid<>(List.of(Cell.of(Content.of("a"), 1, 1),
                                      Cell.<Content>of(null, 2, 1),
                                      Cell.of(Content.of("c"), 3, 1)));

        var merged = grid.merge(Coord.of(1, 1), Coord.of(3, 1), Content.APPENDER);

        assertThat(merged.content()).isEqualTo(Content.of("ac"));

        var leadingNull = new Grid<>(List.of(Cell.<Content>of(null, 1, 1), Cell.of(Content.of("b"), 2, 1)));
        assertThat(leadingNull.merge(Coord.of(1, 1), Coord.of(2, 1), Content.APPENDER).content())
            .isEqualTo(Content.of("b"));
    }
}
