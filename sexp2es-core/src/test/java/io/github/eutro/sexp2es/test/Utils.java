package io.github.eutro.sexp2es.test;

import io.github.eutro.sexp2es.core.estree.Program;
import io.github.eutro.sexp2es.core.ir.Node;
import io.github.eutro.sexp2es.core.passes.convert.IrToEs;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;

import java.util.Arrays;

public class Utils {
    /**
     * Lower the forms with the default special forms, print them, and run them, returning the value of the last one.
     */
    public static Object run(Node... forms) {
        Program program = IrToEs.INSTANCE.run(Arrays.asList(forms));
        return eval("var exports = {};\n" + JsPrinter.print(program));
    }

    public static double runNumber(Node... forms) {
        return Context.toNumber(run(forms));
    }

    public static Object eval(String source) {
        Context cx = Context.enter();
        try {
            cx.setOptimizationLevel(-1);
            cx.setLanguageVersion(Context.VERSION_ES6);
            Scriptable scope = cx.initStandardObjects();
            return cx.evaluateString(scope, source, "test.js", 1, null);
        } finally {
            Context.exit();
        }
    }
}
