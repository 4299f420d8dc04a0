package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** Closure / function literal: {@code (a, b) => a + b}, {@code () async { ... }}. */
public record FunctionExpression(Span span, List<String> typeParameters, FormalParameterList parameters, FunctionBody body) implements Expression {

    public FunctionExpression {
        typeParameters = typeParameters == null ? List.of() : List.copyOf(typeParameters);
        if (parameters == null) parameters = new FormalParameterList(Span.NONE, List.of());
        if (body == null) body = new EmptyFunctionBody(Span.NONE);
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionExpression(this);
    }

    public List<String> parameterNames() {
        return parameters.names();
    }
}
