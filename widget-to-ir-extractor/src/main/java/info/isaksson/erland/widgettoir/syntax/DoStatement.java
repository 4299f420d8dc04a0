package info.isaksson.erland.widgettoir.syntax;

public record DoStatement(Span span, Statement body, Expression condition) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDoStatement(this);
    }
}
