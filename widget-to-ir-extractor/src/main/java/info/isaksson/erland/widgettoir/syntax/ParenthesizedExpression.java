package info.isaksson.erland.widgettoir.syntax;

public record ParenthesizedExpression(Span span, Expression expression) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitParenthesizedExpression(this);
    }
}
