package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/**
 * Constructor call. {@code keyword} is {@code const}, {@code new} or {@code null} (implicit);
 * {@code constructorName} is set for named constructors such as {@code ListView.builder}.
 */
public record InstanceCreationExpression(Span span, String keyword, String typeName, List<String> typeArguments, String constructorName, ArgumentList arguments) implements Expression {

    public InstanceCreationExpression {
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        if (arguments == null) arguments = new ArgumentList(Span.NONE, List.of());
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitInstanceCreationExpression(this);
    }

    public boolean isConst() {
        return "const".equals(keyword);
    }
}
