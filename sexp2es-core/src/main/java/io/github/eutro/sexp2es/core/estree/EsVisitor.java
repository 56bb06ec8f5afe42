package io.github.eutro.sexp2es.core.estree;

/**
 * A visitor over every type of {@link EsNode}.
 *
 * @param <R> The result type.
 */
public interface EsVisitor<R> {
    R visitProgram(Program node);

    R visitIdentifier(Identifier node);

    R visitLiteral(Literal node);

    R visitArrayExpression(ArrayExpression node);

    R visitObjectExpression(ObjectExpression node);

    R visitProperty(Property node);

    R visitFunctionExpression(FunctionExpression node);

    R visitUnaryExpression(UnaryExpression node);

    R visitBinaryExpression(BinaryExpression node);

    R visitLogicalExpression(LogicalExpression node);

    R visitAssignmentExpression(AssignmentExpression node);

    R visitSequenceExpression(SequenceExpression node);

    R visitConditionalExpression(ConditionalExpression node);

    R visitCallExpression(CallExpression node);

    R visitNewExpression(NewExpression node);

    R visitMemberExpression(MemberExpression node);

    R visitExpressionStatement(ExpressionStatement node);

    R visitBlockStatement(BlockStatement node);

    R visitReturnStatement(ReturnStatement node);

    R visitThrowStatement(ThrowStatement node);

    R visitTryStatement(TryStatement node);

    R visitCatchClause(CatchClause node);

    R visitVariableDeclaration(VariableDeclaration node);

    R visitVariableDeclarator(VariableDeclarator node);

    R visitWhileStatement(WhileStatement node);

    R visitIfStatement(IfStatement node);

    R visitSwitchStatement(SwitchStatement node);

    R visitSwitchCase(SwitchCase node);
}
