package info.isaksson.erland.widgettoir.syntax;

public record GuardedPattern(Span span, PatternNode pattern, Expression whenClause) implements SyntaxNode {
}
