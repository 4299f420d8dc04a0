package info.isaksson.erland.widgettoir.syntax;

public record DoubleLiteral(Span span, String lexeme, double value) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDoubleLiteral(this);
    }
}
