package info.isaksson.erland.widgettoir.syntax;

public record BooleanLiteral(Span span, boolean value) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }
}
