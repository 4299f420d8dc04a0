package info.isaksson.erland.widgettoir.ir.expr;

/** Exhaustive dispatch over {@link IrExpression} variants. */
public interface IrExpressionVisitor<R> {
    R visitLiteral(IrLiteralExpression e);
    R visitIdentifier(IrIdentifierExpression e);
    R visitThis(IrThisExpression e);
    R visitSuper(IrSuperExpression e);
    R visitBinary(IrBinaryExpression e);
    R visitUnary(IrUnaryExpression e);
    R visitAssignment(IrAssignmentExpression e);
    R visitCompoundAssignment(IrCompoundAssignmentExpression e);
    R visitConditional(IrConditionalExpression e);
    R visitMethodCall(IrMethodCallExpression e);
    R visitConstructorCall(IrConstructorCallExpression e);
    R visitPropertyAccess(IrPropertyAccessExpression e);
    R visitIndexAccess(IrIndexAccessExpression e);
    R visitListLiteral(IrListLiteralExpression e);
    R visitSetLiteral(IrSetLiteralExpression e);
    R visitMapLiteral(IrMapLiteralExpression e);
    R visitStringInterpolation(IrStringInterpolationExpression e);
    R visitCascade(IrCascadeExpression e);
    R visitNullCoalescing(IrNullCoalescingExpression e);
    R visitLambda(IrLambdaExpression e);
    R visitTypeCheck(IrTypeCheckExpression e);
    R visitCast(IrCastExpression e);
    R visitAwait(IrAwaitExpression e);
    R visitThrow(IrThrowExpression e);
    R visitSwitch(IrSwitchExpression e);
    R visitPatternMatch(IrPatternMatchExpression e);
    R visitSkippedElement(IrSkippedElementExpression e);
    R visitUnknown(IrUnknownExpression e);
}
