package info.isaksson.erland.widgettoir.syntax;

import info.isaksson.erland.widgettoir.element.FieldElement;

public record TopLevelVariableDeclaration(Span span, VariableDeclarationList variables,
                                          FieldElement element) implements Declaration {

    @Override
    public String name() {
        return variables == null || variables.variables().isEmpty() ? "" : variables.variables().get(0).name();
    }
}
