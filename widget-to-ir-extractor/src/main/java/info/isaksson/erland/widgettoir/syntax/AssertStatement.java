package info.isaksson.erland.widgettoir.syntax;

public record AssertStatement(Span span, Expression condition, Expression message) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssertStatement(this);
    }
}
