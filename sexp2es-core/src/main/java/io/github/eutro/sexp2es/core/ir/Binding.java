package io.github.eutro.sexp2es.core.ir;

/**
 * A name bound by a {@link LetNode} or {@link LoopNode}.
 */
public final class Binding {
    public final String name;
    public final Node init;

    public Binding(String name, Node init) {
        this.name = name;
        this.init = init;
    }
}
