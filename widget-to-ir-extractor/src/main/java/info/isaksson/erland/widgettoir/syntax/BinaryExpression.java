package info.isaksson.erland.widgettoir.syntax;

public record BinaryExpression(Span span, Expression left, String operator, Expression right) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }
}
