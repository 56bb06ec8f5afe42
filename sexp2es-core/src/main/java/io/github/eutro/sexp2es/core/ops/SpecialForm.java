package io.github.eutro.sexp2es.core.ops;

import io.github.eutro.sexp2es.core.estree.Expression;
import io.github.eutro.sexp2es.core.ir.InvokeNode;

/**
 * A lowering for applications of a particular name, used instead of a plain call.
 *
 * @see SpecialForms
 */
@FunctionalInterface
public interface SpecialForm {
    /**
     * Lower an application of this form.
     *
     * @param form   The whole application, its callee naming this form.
     * @param writer The writer to lower operands with.
     * @return The lowered expression.
     */
    Expression write(InvokeNode form, FormWriter writer);
}
