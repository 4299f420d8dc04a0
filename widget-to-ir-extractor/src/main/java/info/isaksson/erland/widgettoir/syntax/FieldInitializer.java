package info.isaksson.erland.widgettoir.syntax;

/** {@code : this.x = e} / {@code : x = e}. */
public record FieldInitializer(Span span, String fieldName, Expression expression) implements ConstructorInitializer {
}
