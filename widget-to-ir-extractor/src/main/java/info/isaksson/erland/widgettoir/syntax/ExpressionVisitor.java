package info.isaksson.erland.widgettoir.syntax;

public interface ExpressionVisitor<R> {
    R visitIntegerLiteral(IntegerLiteral node);
    R visitDoubleLiteral(DoubleLiteral node);
    R visitBooleanLiteral(BooleanLiteral node);
    R visitNullLiteral(NullLiteral node);
    R visitSimpleStringLiteral(SimpleStringLiteral node);
    R visitStringInterpolation(StringInterpolation node);
    R visitSimpleIdentifier(SimpleIdentifier node);
    R visitPrefixedIdentifier(PrefixedIdentifier node);
    R visitThisExpression(ThisExpression node);
    R visitSuperExpression(SuperExpression node);
    R visitBinaryExpression(BinaryExpression node);
    R visitPrefixExpression(PrefixExpression node);
    R visitPostfixExpression(PostfixExpression node);
    R visitAssignmentExpression(AssignmentExpression node);
    R visitConditionalExpression(ConditionalExpression node);
    R visitMethodInvocation(MethodInvocation node);
    R visitFunctionExpressionInvocation(FunctionExpressionInvocation node);
    R visitInstanceCreationExpression(InstanceCreationExpression node);
    R visitPropertyAccess(PropertyAccess node);
    R visitIndexExpression(IndexExpression node);
    R visitListLiteral(ListLiteral node);
    R visitSetOrMapLiteral(SetOrMapLiteral node);
    R visitCascadeExpression(CascadeExpression node);
    R visitFunctionExpression(FunctionExpression node);
    R visitParenthesizedExpression(ParenthesizedExpression node);
    R visitIsExpression(IsExpression node);
    R visitAsExpression(AsExpression node);
    R visitAwaitExpression(AwaitExpression node);
    R visitThrowExpression(ThrowExpression node);
    R visitRethrowExpression(RethrowExpression node);
    R visitNamedExpression(NamedExpression node);
    R visitSwitchExpression(SwitchExpression node);
    R visitOpaqueExpression(OpaqueExpression node);
}
