package info.isaksson.erland.widgettoir.syntax;

/** Loop variable of a for-in: {@code final item}, {@code var x}, {@code String s}. */
public record DeclaredIdentifier(Span span, String keyword, String type, String name) implements SyntaxNode {
}
