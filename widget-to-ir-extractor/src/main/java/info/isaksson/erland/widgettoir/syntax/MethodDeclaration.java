package info.isaksson.erland.widgettoir.syntax;

import info.isaksson.erland.widgettoir.element.ExecutableElement;

import java.util.List;

/**
 * Method, getter or setter. {@code propertyKeyword} is {@code get}, {@code set} or {@code null}.
 */
public record MethodDeclaration(Span span, String name, String returnType, String propertyKeyword,
                                FormalParameterList parameters, FunctionBody body, boolean isStatic,
                                ExecutableElement element) implements Declaration {

    public MethodDeclaration {
        if (parameters == null) parameters = new FormalParameterList(Span.NONE, List.of());
        if (body == null) body = new EmptyFunctionBody(Span.NONE);
    }

    public boolean isGetter() {
        return "get".equals(propertyKeyword);
    }

    public boolean isSetter() {
        return "set".equals(propertyKeyword);
    }
}
