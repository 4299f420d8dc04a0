package info.isaksson.erland.widgettoir.syntax;

/** {@code var x}, {@code final String s}. */
public record DeclaredVariablePattern(Span span, String keyword, String type, String name) implements PatternNode {
}
