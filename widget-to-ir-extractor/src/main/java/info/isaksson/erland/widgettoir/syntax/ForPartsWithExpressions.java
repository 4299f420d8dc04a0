package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record ForPartsWithExpressions(Span span, Expression initialization, Expression condition, List<Expression> updaters) implements ForParts {

    public ForPartsWithExpressions {
        updaters = updaters == null ? List.of() : List.copyOf(updaters);
    }
}
