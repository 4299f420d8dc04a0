package info.isaksson.erland.widgettoir.syntax;

public record ContinueStatement(Span span, String label) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitContinueStatement(this);
    }
}
