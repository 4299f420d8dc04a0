package info.isaksson.erland.widgettoir.syntax;

public record IntegerLiteral(Span span, String lexeme, long value) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIntegerLiteral(this);
    }
}
