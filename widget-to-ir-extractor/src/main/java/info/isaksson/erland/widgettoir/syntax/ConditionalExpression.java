package info.isaksson.erland.widgettoir.syntax;

public record ConditionalExpression(Span span, Expression condition, Expression thenExpression, Expression elseExpression) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConditionalExpression(this);
    }
}
