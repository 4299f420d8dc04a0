package info.isaksson.erland.widgettoir.syntax;

/** Record, object, list, map, logical and relational patterns, kept as text. */
public record OpaquePattern(Span span, String nodeType, String source) implements PatternNode {
}
