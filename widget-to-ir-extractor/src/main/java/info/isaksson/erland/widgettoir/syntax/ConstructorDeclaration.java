package info.isaksson.erland.widgettoir.syntax;

import info.isaksson.erland.widgettoir.element.ConstructorElement;

import java.util.List;

/**
 * {@code const Name.named(params) : initializers { body }} or {@code factory Name() = Other;}.
 * {@code constructorName} is null for the unnamed constructor.
 */
public record ConstructorDeclaration(Span span, String className, String constructorName,
                                     FormalParameterList parameters, List<ConstructorInitializer> initializers,
                                     FunctionBody body, boolean isConst, boolean isFactory,
                                     String redirectedConstructor, ConstructorElement element) implements Declaration {

    public ConstructorDeclaration {
        if (parameters == null) parameters = new FormalParameterList(Span.NONE, List.of());
        initializers = initializers == null ? List.of() : List.copyOf(initializers);
        if (body == null) body = new EmptyFunctionBody(Span.NONE);
    }

    @Override
    public String name() {
        return constructorName == null || constructorName.isEmpty() ? className : className + "." + constructorName;
    }
}
