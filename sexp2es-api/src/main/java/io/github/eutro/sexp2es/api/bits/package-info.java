/**
 * Reusable extensions to a compiler or compilation, such as writing output to disk.
 */
package io.github.eutro.sexp2es.api.bits;
