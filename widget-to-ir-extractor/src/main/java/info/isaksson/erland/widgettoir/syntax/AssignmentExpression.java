package info.isaksson.erland.widgettoir.syntax;

/** {@code a = b} and compound forms such as {@code a += b} or {@code a ??= b}. */
public record AssignmentExpression(Span span, Expression left, String operator, Expression right) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssignmentExpression(this);
    }
}
