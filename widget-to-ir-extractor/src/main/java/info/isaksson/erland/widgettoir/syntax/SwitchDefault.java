package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record SwitchDefault(Span span, List<String> labels, List<Statement> statements) implements SwitchMember {

    public SwitchDefault {
        labels = labels == null ? List.of() : List.copyOf(labels);
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
