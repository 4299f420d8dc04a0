package info.isaksson.erland.widgettoir.syntax;

public record EmptyStatement(Span span) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitEmptyStatement(this);
    }
}
