package info.isaksson.erland.widgettoir.syntax;

public record AssertInitializer(Span span, Expression condition, Expression message) implements ConstructorInitializer {
}
