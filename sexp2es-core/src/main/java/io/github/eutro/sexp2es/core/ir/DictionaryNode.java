package io.github.eutro.sexp2es.core.ir;

import java.util.List;

/**
 * A dictionary literal. {@link #keys} and {@link #values} are parallel lists.
 */
public final class DictionaryNode extends Node {
    public final List<Node> keys;
    public final List<Node> values;

    public DictionaryNode(List<Node> keys, List<Node> values) {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("keys and values differ in length");
        }
        this.keys = keys;
        this.values = values;
    }

    @Override
    public String kind() {
        return "dictionary";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDictionary(this);
    }
}
