package io.github.eutro.sexp2es.core.ops;

import io.github.eutro.sexp2es.core.estree.Expression;
import io.github.eutro.sexp2es.core.ir.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * The lowering state a {@link SpecialForm} writes its operands with.
 */
public interface FormWriter {
    /**
     * Lower a node in expression position.
     *
     * @param node The node.
     * @return The lowered expression.
     */
    Expression write(Node node);

    /**
     * Lower each of the nodes in expression position, in order.
     *
     * @param nodes The nodes.
     * @return The lowered expressions.
     */
    default List<Expression> writeAll(List<Node> nodes) {
        List<Expression> exprs = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            exprs.add(write(node));
        }
        return exprs;
    }
}
