package info.isaksson.erland.widgettoir.syntax;

public record WildcardPattern(Span span, String type) implements PatternNode {
}
