package info.isaksson.erland.widgettoir.syntax;

public record AsExpression(Span span, Expression expression, String type) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAsExpression(this);
    }
}
