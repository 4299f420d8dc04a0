package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** {@code {...}} literal; whether it is a set or a map follows the front-end's rules ({@link #isMap()}). */
public record SetOrMapLiteral(Span span, boolean isConst, List<String> typeArguments, List<CollectionElement> elements) implements Expression {

    public SetOrMapLiteral {
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSetOrMapLiteral(this);
    }

    /** Map when it has map entries or two type arguments; an untyped empty {@code {}} is a map too. */
    public boolean isMap() {
        if (typeArguments.size() == 2) return true;
        if (typeArguments.size() == 1) return false;
        for (CollectionElement e : elements) {
            if (e instanceof MapLiteralEntry) return true;
        }
        return elements.isEmpty();
    }
}
