package io.github.eutro.sexp2es.core.passes.convert;

import io.github.eutro.sexp2es.core.estree.Expression;
import io.github.eutro.sexp2es.core.estree.Program;
import io.github.eutro.sexp2es.core.estree.Statement;
import io.github.eutro.sexp2es.core.ir.Node;
import io.github.eutro.sexp2es.core.ops.SpecialForms;
import io.github.eutro.sexp2es.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which lowers analyzed forms to an ESTree {@link Program}.
 * <p>
 * Each top-level form becomes statements of the program. Applications of a name in the
 * {@link SpecialForms special form table} are lowered by that form, everything else
 * by the lowering for its kind of node.
 * <p>
 * This pass keeps no state between runs, so one instance may lower many programs.
 */
public class IrToEs implements IRPass<List<Node>, Program> {
    /**
     * A lowering with the {@link SpecialForms#defaults() default operators}.
     */
    public static final IrToEs INSTANCE = new IrToEs(SpecialForms.defaults());

    private final SpecialForms forms;
    @Nullable
    private final String source;

    /**
     * Construct a lowering pass with a table of special forms.
     *
     * @param forms The special forms.
     */
    public IrToEs(SpecialForms forms) {
        this(forms, null);
    }

    /**
     * Construct a lowering pass with a table of special forms, that names a source file in output locations.
     *
     * @param forms  The special forms.
     * @param source The source file name, or null.
     */
    public IrToEs(SpecialForms forms, @Nullable String source) {
        this.forms = forms;
        this.source = source;
    }

    public SpecialForms getForms() {
        return forms;
    }

    @Override
    public Program run(List<Node> nodes) {
        Lowering lowering = new Lowering(forms, source);
        List<Statement> body = new ArrayList<>();
        for (Node node : nodes) {
            lowering.writeStatement(node, body);
        }
        return new Program(body);
    }

    /**
     * Lower a single node in expression position.
     *
     * @param node The node.
     * @return The expression.
     */
    public Expression writeExpression(Node node) {
        return new Lowering(forms, source).write(node);
    }

    /**
     * Lower statements, followed by a return of the result if there is one.
     *
     * @param statements The statements.
     * @param result     The result, or null.
     * @return The statements of the function body.
     */
    public List<Statement> writeBody(List<Node> statements, @Nullable Node result) {
        return new Lowering(forms, source).writeBody(statements, result);
    }
}
