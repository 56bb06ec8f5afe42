/**
 * Special forms, the named operators that lower to dedicated ESTree shapes instead of calls.
 *
 * @see io.github.eutro.sexp2es.core.ops.SpecialForms
 */
package io.github.eutro.sexp2es.core.ops;
