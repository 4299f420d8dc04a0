package info.isaksson.erland.widgettoir.syntax;

public record ForStatement(Span span, boolean isAwait, ForLoopParts parts, Statement body) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForStatement(this);
    }

    public boolean isForEach() {
        return parts instanceof ForEachParts;
    }
}
