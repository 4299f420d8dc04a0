package info.isaksson.erland.widgettoir.syntax;

import info.isaksson.erland.widgettoir.element.Element;

/** Top-level or class-member declaration. */
public sealed interface Declaration extends SyntaxNode permits ClassDeclaration, MethodDeclaration,
        ConstructorDeclaration, FieldDeclaration, FunctionDeclaration, TopLevelVariableDeclaration {

    String name();

    /** Resolved element, or null when the front-end could not resolve the declaration. */
    Element element();
}
