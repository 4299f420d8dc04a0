package info.isaksson.erland.widgettoir.syntax;

public record YieldStatement(Span span, Expression expression, boolean star) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitYieldStatement(this);
    }
}
