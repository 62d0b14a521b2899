package org.pragmatica.table.grid;

/**
 * Characters used to draw a grid.
 */
public record TileSet(char corner, char horizontal, char vertical) {

    public static final TileSet ASCII = new TileSet('+', '-', '|');
}
