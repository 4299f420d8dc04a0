package info.isaksson.erland.widgettoir.syntax;

/** Named argument {@code name: expression}. */
public record NamedExpression(Span span, String name, Expression expression) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNamedExpression(this);
    }
}
