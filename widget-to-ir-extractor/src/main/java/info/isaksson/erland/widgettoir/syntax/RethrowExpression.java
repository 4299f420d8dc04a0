package info.isaksson.erland.widgettoir.syntax;

public record RethrowExpression(Span span) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRethrowExpression(this);
    }
}
