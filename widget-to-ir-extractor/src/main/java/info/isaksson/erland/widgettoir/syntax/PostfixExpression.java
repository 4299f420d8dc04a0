package info.isaksson.erland.widgettoir.syntax;

public record PostfixExpression(Span span, Expression operand, String operator) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPostfixExpression(this);
    }
}
