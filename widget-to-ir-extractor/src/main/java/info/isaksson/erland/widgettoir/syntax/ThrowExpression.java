package info.isaksson.erland.widgettoir.syntax;

public record ThrowExpression(Span span, Expression expression) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitThrowExpression(this);
    }
}
