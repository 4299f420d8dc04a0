package info.isaksson.erland.widgettoir.syntax;

/** Identifier; {@code library} is the URI of the declaring library when the front-end resolved it. */
public record SimpleIdentifier(Span span, String name, String library) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSimpleIdentifier(this);
    }
}
