package info.isaksson.erland.widgettoir.syntax;

public record ForEachPartsWithIdentifier(Span span, SimpleIdentifier identifier, Expression iterable) implements ForEachParts {

    @Override public String variableName() {
        return identifier == null ? null : identifier.name();
    }
}
