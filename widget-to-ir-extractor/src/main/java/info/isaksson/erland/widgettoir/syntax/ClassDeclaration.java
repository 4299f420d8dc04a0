package info.isaksson.erland.widgettoir.syntax;

import info.isaksson.erland.widgettoir.element.ClassElement;

import java.util.List;

public record ClassDeclaration(Span span, String name, String superclass, List<Declaration> members,
                               ClassElement element) implements Declaration {

    public ClassDeclaration {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
