package info.isaksson.erland.widgettoir.ir.expr;

/** Closed set of unary operators (prefix or postfix is recorded on the node). */
public enum IrUnaryOperator {
    NOT("!"),
    NEGATE("-"),
    BITWISE_NOT("~"),
    INCREMENT("++"),
    DECREMENT("--");

    public final String lexeme;

    IrUnaryOperator(String lexeme) {
        this.lexeme = lexeme;
    }

    public static IrUnaryOperator fromLexeme(String lexeme) {
        if (lexeme == null) return null;
        String op = lexeme.trim();
        for (IrUnaryOperator o : values()) {
            if (o.lexeme.equals(op)) return o;
        }
        return null;
    }

    public boolean isIncrementOrDecrement() {
        return this == INCREMENT || this == DECREMENT;
    }
}
