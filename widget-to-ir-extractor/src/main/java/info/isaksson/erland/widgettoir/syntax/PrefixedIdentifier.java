package info.isaksson.erland.widgettoir.syntax;

/** {@code prefix.identifier}, e.g. {@code Colors.red} or {@code widget.title}. */
public record PrefixedIdentifier(Span span, SimpleIdentifier prefix, SimpleIdentifier identifier) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPrefixedIdentifier(this);
    }
}
