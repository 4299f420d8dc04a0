package info.isaksson.erland.widgettoir.syntax;

/** String literal without interpolation; {@code lexeme} keeps the quotes as written. */
public record SimpleStringLiteral(Span span, String lexeme, String value) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSimpleStringLiteral(this);
    }
}
