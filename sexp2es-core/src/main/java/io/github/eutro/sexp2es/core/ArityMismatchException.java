package io.github.eutro.sexp2es.core;

import io.github.eutro.sexp2es.core.ir.Node;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when an operator form is applied to a number of operands it does not accept.
 */
public class ArityMismatchException extends CompileException {
    private final String operator;
    private final int got;

    public ArityMismatchException(String operator, int got, @Nullable Node node) {
        super("Wrong number of arguments (" + got + ") passed to: " + operator, node);
        this.operator = operator;
        this.got = got;
    }

    public String getOperator() {
        return operator;
    }

    public int getGot() {
        return got;
    }
}
