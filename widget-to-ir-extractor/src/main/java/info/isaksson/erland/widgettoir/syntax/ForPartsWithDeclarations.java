package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record ForPartsWithDeclarations(Span span, VariableDeclarationList variables, Expression condition, List<Expression> updaters) implements ForParts {

    public ForPartsWithDeclarations {
        updaters = updaters == null ? List.of() : List.copyOf(updaters);
    }
}
