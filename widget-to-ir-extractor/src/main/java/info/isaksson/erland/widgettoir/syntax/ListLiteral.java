package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record ListLiteral(Span span, boolean isConst, List<String> typeArguments, List<CollectionElement> elements) implements Expression {

    public ListLiteral {
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitListLiteral(this);
    }
}
