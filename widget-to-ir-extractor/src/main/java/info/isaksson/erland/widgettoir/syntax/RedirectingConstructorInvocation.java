package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** {@code : this.named(args)}. */
public record RedirectingConstructorInvocation(Span span, String constructorName, ArgumentList arguments) implements ConstructorInitializer {

    public RedirectingConstructorInvocation {
        if (arguments == null) arguments = new ArgumentList(Span.NONE, List.of());
    }
}
