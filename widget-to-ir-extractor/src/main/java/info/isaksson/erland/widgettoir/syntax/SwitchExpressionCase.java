package info.isaksson.erland.widgettoir.syntax;

public record SwitchExpressionCase(Span span, GuardedPattern guardedPattern, Expression expression) implements SyntaxNode {
}
