package info.isaksson.erland.widgettoir.syntax;

public record AwaitExpression(Span span, Expression expression) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAwaitExpression(this);
    }
}
