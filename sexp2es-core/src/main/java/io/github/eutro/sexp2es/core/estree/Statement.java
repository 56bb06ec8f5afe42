package io.github.eutro.sexp2es.core.estree;

/**
 * Any node that can appear in a statement list.
 */
public abstract class Statement extends EsNode {
}
