package io.github.eutro.sexp2es.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A module declaration, with the modules it requires.
 */
public final class NsNode extends Node {
    public final String name;
    @Nullable
    public final String doc;
    public final List<Require> require;

    public NsNode(String name, @Nullable String doc, List<Require> require) {
        this.name = name;
        this.doc = doc;
        this.require = require;
    }

    @Override
    public String kind() {
        return "ns";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNs(this);
    }

    public static final class Require {
        public final String ns;
        @Nullable
        public final String alias;
        public final List<Refer> refer;

        public Require(String ns, @Nullable String alias, List<Refer> refer) {
            this.ns = ns;
            this.alias = alias;
            this.refer = refer;
        }
    }

    /**
     * A symbol pulled into scope from a required module, optionally under another name.
     */
    public static final class Refer {
        public final String name;
        @Nullable
        public final String rename;

        public Refer(String name, @Nullable String rename) {
            this.name = name;
            this.rename = rename;
        }
    }
}
