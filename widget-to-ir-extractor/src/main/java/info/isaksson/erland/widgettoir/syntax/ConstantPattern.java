package info.isaksson.erland.widgettoir.syntax;

public record ConstantPattern(Span span, Expression expression) implements PatternNode {
}
