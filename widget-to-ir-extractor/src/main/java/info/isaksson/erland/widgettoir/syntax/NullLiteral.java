package info.isaksson.erland.widgettoir.syntax;

public record NullLiteral(Span span) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNullLiteral(this);
    }
}
