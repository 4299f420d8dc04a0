package info.isaksson.erland.widgettoir.syntax;

public record WhileStatement(Span span, Expression condition, Statement body) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }
}
