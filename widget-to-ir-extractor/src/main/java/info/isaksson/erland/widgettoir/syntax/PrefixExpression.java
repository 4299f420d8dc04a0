package info.isaksson.erland.widgettoir.syntax;

public record PrefixExpression(Span span, String operator, Expression operand) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPrefixExpression(this);
    }
}
