package info.isaksson.erland.widgettoir.syntax;

import java.util.ArrayList;
import java.util.List;

public record FormalParameterList(Span span, List<FormalParameter> parameters) implements SyntaxNode {

    public FormalParameterList {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /** Declared names in order, skipping unnamed parameters. */
    public List<String> names() {
        List<String> out = new ArrayList<>();
        for (FormalParameter p : parameters) {
            if (p.name() != null && !p.name().isEmpty()) out.add(p.name());
        }
        return out;
    }
}
