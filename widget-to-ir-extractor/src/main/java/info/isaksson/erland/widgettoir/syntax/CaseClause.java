package info.isaksson.erland.widgettoir.syntax;

/** {@code case P when g} following an if condition. */
public record CaseClause(Span span, GuardedPattern guardedPattern) implements SyntaxNode {
}
