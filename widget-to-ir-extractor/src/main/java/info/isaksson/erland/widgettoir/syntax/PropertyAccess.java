package info.isaksson.erland.widgettoir.syntax;

/** {@code target.name} / {@code target?.name}; {@code target} is {@code null} inside cascade sections. */
public record PropertyAccess(Span span, Expression target, String operator, String propertyName) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPropertyAccess(this);
    }

    public boolean isNullAware() {
        return operator != null && operator.startsWith("?");
    }

    public boolean isCascaded() {
        return operator != null && operator.endsWith("..");
    }
}
