package io.github.eutro.sexp2es.core.passes.convert;

import io.github.eutro.sexp2es.core.estree.Expression;
import io.github.eutro.sexp2es.core.estree.Statement;
import io.github.eutro.sexp2es.core.ir.NsNode;
import io.github.eutro.sexp2es.core.support.NameMangler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.sexp2es.core.estree.Es.*;

/**
 * Lowers a namespace declaration to the statements that declare its metadata and import its requirements.
 * <p>
 * For {@code (ns foo.bar "Docs." (:require [foo.baz :as baz :refer [qux]]))}:
 * <pre>{@code
 * var _ns_ = {id: "foo.bar", doc: "Docs."};
 * var foo_baz = require("./baz");
 * var baz = foo_baz;
 * var qux = foo_baz.qux;
 * }</pre>
 */
public final class NamespaceEmitter {
    /**
     * The name of the variable that holds the namespace metadata.
     */
    public static final String METADATA = "_ns_";

    private NamespaceEmitter() {
    }

    public static List<Statement> emit(NsNode ns) {
        List<Statement> out = new ArrayList<>();
        Expression doc = ns.doc == null ? voidZero() : literal(ns.doc);
        out.add(var(METADATA, object(property("id", literal(ns.name)), property("doc", doc))));
        for (NsNode.Require require : ns.require) {
            String local = localName(require.ns);
            out.add(var(local, call(identifier("require"), literal(resolve(ns.name, require.ns)))));
            if (require.alias != null) {
                out.add(var(mangle(require.alias), identifier(local)));
            }
            for (NsNode.Refer refer : require.refer) {
                String name = refer.rename == null ? refer.name : refer.rename;
                out.add(var(mangle(name), member(identifier(local), mangle(refer.name))));
            }
        }
        return out;
    }

    /**
     * Get the name of the variable a required module is bound to, {@code foo_bar} for {@code foo.bar}.
     *
     * @param ns The name of the required module.
     * @return The variable name.
     */
    public static String localName(String ns) {
        return mangle(ns.replace('.', '*'));
    }

    /**
     * Resolve the path {@code requirer} imports {@code requirement} by.
     * <p>
     * Modules under the same root are imported relatively, {@code resolve("a.b.c", "a.b.d.e")}
     * is {@code "./d/e"}. Anything else, including a module importing itself, is imported
     * by its full path, {@code resolve("a.b", "x.y")} is {@code "x/y"}.
     *
     * @param requirer    The importing module.
     * @param requirement The imported module.
     * @return The path.
     */
    public static String resolve(String requirer, String requirement) {
        String[] from = requirer.split("\\.");
        String[] to = requirement.split("\\.");
        if (requirer.equals(requirement) || !from[0].equals(to[0])) {
            return String.join("/", to);
        }
        int common = 0;
        while (common < from.length && common < to.length && from[common].equals(to[common])) {
            common++;
        }
        List<String> path = new ArrayList<>();
        path.add(".");
        for (int i = common + 1; i < from.length; i++) {
            path.add("..");
        }
        path.addAll(Arrays.asList(to).subList(common, to.length));
        return String.join("/", path);
    }

    private static String mangle(String name) {
        return NameMangler.ES_IDENT.mangle(name);
    }
}
