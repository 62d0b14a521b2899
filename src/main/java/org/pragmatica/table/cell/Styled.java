package org.pragmatica.table.cell;

import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Base of everything that carries user styles and a nature: tables, rows, columns and cells.
 *
 * <p>Styles are free-form key-value pairs (border, alignment, ...). Each styled object owns its
 * map: assigning styles copies the entries, so two objects never share one.
 *
 * <p>The nature distinguishes header, body and footer content. It defaults to "body".
 */
public abstract class Styled {
    public static final String BODY = "body";

    private Map<String, String> styles;
    private String nature;

    protected Styled(Map<String, String> styles, String nature) {
        setStyles(styles);
        this.nature = nature;
    }

    /**
     * The owned, mutable style map.
     */
    public Map<String, String> styles() {
        return styles;
    }

    public void setStyles(Map<String, String> styles) {
        this.styles = styles == null
                      ? Maps.newLinkedHashMap()
                      : Maps.newLinkedHashMap(styles);
    }

    public String nature() {
        return nature;
    }

    public void setNature(String nature) {
        this.nature = nature;
    }
}
