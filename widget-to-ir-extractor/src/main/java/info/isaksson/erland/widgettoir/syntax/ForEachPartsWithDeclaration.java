package info.isaksson.erland.widgettoir.syntax;

public record ForEachPartsWithDeclaration(Span span, DeclaredIdentifier loopVariable, Expression iterable) implements ForEachParts {

    @Override public String variableName() {
        return loopVariable == null ? null : loopVariable.name();
    }
}
