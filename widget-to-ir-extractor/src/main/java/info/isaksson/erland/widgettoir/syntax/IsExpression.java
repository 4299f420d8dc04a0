package info.isaksson.erland.widgettoir.syntax;

public record IsExpression(Span span, Expression expression, String type, boolean negated) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIsExpression(this);
    }
}
