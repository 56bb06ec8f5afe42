package io.github.eutro.sexp2es.core.estree;

/**
 * Any node that can appear where a value is expected.
 */
public abstract class Expression extends EsNode {
}
