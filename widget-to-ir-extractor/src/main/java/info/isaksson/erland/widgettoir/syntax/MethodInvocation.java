package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/**
 * {@code target.method(args)}. {@code target} is {@code null} for unqualified calls and inside cascade
 * sections; {@code operator} is {@code .}, {@code ?.}, {@code ..} or {@code ?..}.
 */
public record MethodInvocation(Span span, Expression target, String operator, String methodName, List<String> typeArguments, ArgumentList arguments) implements Expression {

    public MethodInvocation {
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        if (arguments == null) arguments = new ArgumentList(Span.NONE, List.of());
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMethodInvocation(this);
    }

    public boolean isNullAware() {
        return operator != null && operator.startsWith("?");
    }

    public boolean isCascaded() {
        return operator != null && operator.endsWith("..");
    }
}
