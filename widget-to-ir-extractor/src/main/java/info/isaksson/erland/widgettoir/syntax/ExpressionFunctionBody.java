package info.isaksson.erland.widgettoir.syntax;

/** Arrow body {@code => expression}. */
public record ExpressionFunctionBody(Span span, Expression expression, boolean isAsync) implements FunctionBody {

    @Override public boolean isGenerator() {
        return false;
    }
}
