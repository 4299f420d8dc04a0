package info.isaksson.erland.widgettoir.syntax;

public record VariableDeclarationStatement(Span span, VariableDeclarationList variables) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariableDeclarationStatement(this);
    }
}
