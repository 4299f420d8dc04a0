package info.isaksson.erland.widgettoir.syntax;

public record ThisExpression(Span span) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitThisExpression(this);
    }
}
