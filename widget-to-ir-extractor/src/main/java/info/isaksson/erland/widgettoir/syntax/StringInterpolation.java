package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** {@code 'Hello $name, ${a + b}!'}: text and embedded expressions in source order. */
public record StringInterpolation(Span span, List<InterpolationElement> elements) implements Expression {

    public StringInterpolation {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStringInterpolation(this);
    }
}
