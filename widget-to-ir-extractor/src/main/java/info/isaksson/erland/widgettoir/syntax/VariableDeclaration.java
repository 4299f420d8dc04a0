package info.isaksson.erland.widgettoir.syntax;

public record VariableDeclaration(Span span, String name, Expression initializer) implements SyntaxNode {
}
