package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record TryStatement(Span span, Block body, List<CatchClause> catchClauses, Block finallyBlock) implements Statement {

    public TryStatement {
        catchClauses = catchClauses == null ? List.of() : List.copyOf(catchClauses);
    }

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitTryStatement(this);
    }
}
