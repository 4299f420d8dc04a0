package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record SuperConstructorInvocation(Span span, String constructorName, ArgumentList arguments) implements ConstructorInitializer {

    public SuperConstructorInvocation {
        if (arguments == null) arguments = new ArgumentList(Span.NONE, List.of());
    }
}
