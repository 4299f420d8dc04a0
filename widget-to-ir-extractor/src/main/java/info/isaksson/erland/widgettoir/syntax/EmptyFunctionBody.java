package info.isaksson.erland.widgettoir.syntax;

/** Abstract or external member: {@code ;}. */
public record EmptyFunctionBody(Span span) implements FunctionBody {

    @Override public boolean isAsync() {
        return false;
    }

    @Override public boolean isGenerator() {
        return false;
    }
}
