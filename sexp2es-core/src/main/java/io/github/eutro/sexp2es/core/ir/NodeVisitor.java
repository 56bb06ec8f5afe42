package io.github.eutro.sexp2es.core.ir;

/**
 * A visitor over every kind of {@link Node}.
 *
 * @param <R> The result type.
 */
public interface NodeVisitor<R> {
    R visitNil(NilNode node);

    R visitConstant(ConstantNode node);

    R visitKeyword(KeywordNode node);

    R visitVar(VarNode node);

    R visitVector(VectorNode node);

    R visitDictionary(DictionaryNode node);

    R visitInvoke(InvokeNode node);

    R visitNew(NewNode node);

    R visitDef(DefNode node);

    R visitSet(SetNode node);

    R visitMemberAccess(MemberAccessNode node);

    R visitIf(IfNode node);

    R visitThrow(ThrowNode node);

    R visitTry(TryNode node);

    R visitDo(DoNode node);

    R visitLet(LetNode node);

    R visitLoop(LoopNode node);

    R visitRecur(RecurNode node);

    R visitFn(FnNode node);

    R visitNs(NsNode node);
}
