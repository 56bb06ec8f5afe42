/**
 * The interface to the external printer that renders lowered programs as text.
 */
package io.github.eutro.sexp2es.api.printer;
