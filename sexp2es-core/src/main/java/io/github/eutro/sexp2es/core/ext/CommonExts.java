package io.github.eutro.sexp2es.core.ext;

import io.github.eutro.sexp2es.core.ir.Location;

public class CommonExts {
    /**
     * The source span an IR node was read from, copied onto every ESTree node lowered from it.
     */
    public static final Ext<Location> LOCATION = Ext.create(Location.class, "LOCATION");

    /**
     * The original symbol of an IR node, before analysis, for diagnostics.
     */
    public static final Ext<String> ORIGINAL_FORM = Ext.create(String.class, "ORIGINAL_FORM");
}
