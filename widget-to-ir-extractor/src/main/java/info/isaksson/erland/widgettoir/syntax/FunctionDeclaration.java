package info.isaksson.erland.widgettoir.syntax;

import info.isaksson.erland.widgettoir.element.ExecutableElement;

/** Top-level or local function; the parameters and body live in {@code function}. */
public record FunctionDeclaration(Span span, String name, String returnType, String propertyKeyword,
                                  FunctionExpression function, ExecutableElement element) implements Declaration {
}
