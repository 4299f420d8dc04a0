package info.isaksson.erland.widgettoir.syntax;

import java.util.List;
import java.util.stream.Collectors;

public record ArgumentList(Span span, List<Expression> arguments) implements SyntaxNode {

    public ArgumentList {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public List<Expression> positional() {
        return arguments.stream().filter(a -> !(a instanceof NamedExpression)).collect(Collectors.toList());
    }

    public List<NamedExpression> named() {
        return arguments.stream()
                .filter(NamedExpression.class::isInstance)
                .map(NamedExpression.class::cast)
                .collect(Collectors.toList());
    }

    public NamedExpression named(String name) {
        for (Expression a : arguments) {
            if (a instanceof NamedExpression && ((NamedExpression) a).name().equals(name)) return (NamedExpression) a;
        }
        return null;
    }
}
