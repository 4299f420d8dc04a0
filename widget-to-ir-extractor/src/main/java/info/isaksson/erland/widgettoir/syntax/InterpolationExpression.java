package info.isaksson.erland.widgettoir.syntax;

/** {@code $name} ({@code braced} false) or {@code ${expr}}. */
public record InterpolationExpression(Span span, Expression expression, boolean braced) implements InterpolationElement {
}
