package info.isaksson.erland.widgettoir.syntax;

public record ReturnStatement(Span span, Expression expression) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
