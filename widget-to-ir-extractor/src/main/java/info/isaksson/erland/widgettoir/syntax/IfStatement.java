package info.isaksson.erland.widgettoir.syntax;

public record IfStatement(Span span, Expression condition, CaseClause caseClause, Statement thenStatement, Statement elseStatement) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
