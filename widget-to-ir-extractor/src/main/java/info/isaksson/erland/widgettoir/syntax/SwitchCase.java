package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** Classic {@code case constant:} member. */
public record SwitchCase(Span span, List<String> labels, Expression expression, List<Statement> statements) implements SwitchMember {

    public SwitchCase {
        labels = labels == null ? List.of() : List.copyOf(labels);
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
