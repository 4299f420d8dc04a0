package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** {@code case Pattern when guard:} member. */
public record SwitchPatternCase(Span span, List<String> labels, GuardedPattern guardedPattern, List<Statement> statements) implements SwitchMember {

    public SwitchPatternCase {
        labels = labels == null ? List.of() : List.copyOf(labels);
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
