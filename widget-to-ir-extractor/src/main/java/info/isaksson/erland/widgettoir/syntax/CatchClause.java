package info.isaksson.erland.widgettoir.syntax;

/** {@code on T catch (e, st) { ... }}. */
public record CatchClause(Span span, String exceptionType, String exceptionParameter, String stackTraceParameter, Block body) implements SyntaxNode {
}
