package info.isaksson.erland.widgettoir.syntax;

public record FunctionDeclarationStatement(Span span, FunctionDeclaration function) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionDeclarationStatement(this);
    }
}
