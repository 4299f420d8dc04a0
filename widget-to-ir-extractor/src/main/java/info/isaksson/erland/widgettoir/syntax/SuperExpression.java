package info.isaksson.erland.widgettoir.syntax;

public record SuperExpression(Span span) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSuperExpression(this);
    }
}
