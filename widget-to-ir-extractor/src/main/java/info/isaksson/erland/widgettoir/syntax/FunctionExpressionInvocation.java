package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** Call of an expression that evaluates to a function, e.g. {@code callbacks[i](x)}. */
public record FunctionExpressionInvocation(Span span, Expression function, List<String> typeArguments, ArgumentList arguments) implements Expression {

    public FunctionExpressionInvocation {
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        if (arguments == null) arguments = new ArgumentList(Span.NONE, List.of());
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionExpressionInvocation(this);
    }
}
