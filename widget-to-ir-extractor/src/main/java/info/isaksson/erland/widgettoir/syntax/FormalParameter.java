package info.isaksson.erland.widgettoir.syntax;

public record FormalParameter(Span span, String name, String type, Kind kind, boolean isRequired, Expression defaultValue) implements SyntaxNode {

    public FormalParameter {
        if (kind == null) kind = Kind.REQUIRED_POSITIONAL;
    }

    public enum Kind {
        REQUIRED_POSITIONAL,
        OPTIONAL_POSITIONAL,
        NAMED
    }
}
