package info.isaksson.erland.widgettoir.syntax;

public record BreakStatement(Span span, String label) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBreakStatement(this);
    }
}
