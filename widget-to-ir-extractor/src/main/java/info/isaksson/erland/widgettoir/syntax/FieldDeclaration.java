package info.isaksson.erland.widgettoir.syntax;

import info.isaksson.erland.widgettoir.element.FieldElement;

public record FieldDeclaration(Span span, boolean isStatic, VariableDeclarationList fields,
                               FieldElement element) implements Declaration {

    /** Name of the first declared variable. */
    @Override
    public String name() {
        return fields == null || fields.variables().isEmpty() ? "" : fields.variables().get(0).name();
    }
}
