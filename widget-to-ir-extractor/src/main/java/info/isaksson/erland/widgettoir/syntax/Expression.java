package info.isaksson.erland.widgettoir.syntax;

public sealed interface Expression extends CollectionElement permits
        IntegerLiteral, DoubleLiteral, BooleanLiteral, NullLiteral, SimpleStringLiteral, StringInterpolation,
        SimpleIdentifier, PrefixedIdentifier, ThisExpression, SuperExpression,
        BinaryExpression, PrefixExpression, PostfixExpression, AssignmentExpression, ConditionalExpression,
        MethodInvocation, FunctionExpressionInvocation, InstanceCreationExpression, PropertyAccess, IndexExpression,
        ListLiteral, SetOrMapLiteral, CascadeExpression, FunctionExpression, ParenthesizedExpression,
        IsExpression, AsExpression, AwaitExpression, ThrowExpression, RethrowExpression, NamedExpression,
        SwitchExpression, OpaqueExpression {

    <R> R accept(ExpressionVisitor<R> visitor);

    /** Strips any number of enclosing parentheses. */
    default Expression unparenthesized() {
        Expression e = this;
        while (e instanceof ParenthesizedExpression) {
            e = ((ParenthesizedExpression) e).expression();
        }
        return e;
    }
}
