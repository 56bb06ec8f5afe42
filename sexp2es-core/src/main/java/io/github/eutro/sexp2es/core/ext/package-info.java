/**
 * Typed side-data for IR nodes.
 * <p>
 * Every {@link io.github.eutro.sexp2es.core.ir.Node} is an {@link io.github.eutro.sexp2es.core.ext.ExtHolder},
 * so a reader or analyzer can attach what it knows without the IR classes changing:
 *
 * <pre>{@code
 * static final Ext<Integer> DEPTH = Ext.create(Integer.class, "depth");
 *
 * node.attachExt(CommonExts.LOCATION, new Location(3, 1, 3, 12));
 * node.attachExt(DEPTH, 2);
 * node.getNullable(DEPTH); // => 2
 * }</pre>
 * Lowering reads {@link io.github.eutro.sexp2es.core.ext.CommonExts#LOCATION} to fill in ESTree locations,
 * and {@link io.github.eutro.sexp2es.core.ext.CommonExts#ORIGINAL_FORM} to quote forms in errors.
 */
package io.github.eutro.sexp2es.core.ext;
