package info.isaksson.erland.widgettoir.syntax;

public record ExpressionStatement(Span span, Expression expression) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
