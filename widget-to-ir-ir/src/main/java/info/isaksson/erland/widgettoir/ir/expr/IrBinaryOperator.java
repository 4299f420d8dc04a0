package info.isaksson.erland.widgettoir.ir.expr;

/**
 * Closed set of binary operators. Raw lexemes are mapped once, at extraction time.
 */
public enum IrBinaryOperator {
    ADD("+", Category.ARITHMETIC),
    SUBTRACT("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    MODULO("%", Category.ARITHMETIC),
    INTEGER_DIVIDE("~/", Category.ARITHMETIC),
    EQUALS("==", Category.COMPARISON),
    NOT_EQUALS("!=", Category.COMPARISON),
    LESS_THAN("<", Category.COMPARISON),
    GREATER_THAN(">", Category.COMPARISON),
    LESS_OR_EQUAL("<=", Category.COMPARISON),
    GREATER_OR_EQUAL(">=", Category.COMPARISON),
    LOGICAL_AND("&&", Category.LOGICAL),
    LOGICAL_OR("||", Category.LOGICAL),
    BITWISE_AND("&", Category.BITWISE),
    BITWISE_OR("|", Category.BITWISE),
    BITWISE_XOR("^", Category.BITWISE),
    SHIFT_LEFT("<<", Category.BITWISE),
    SHIFT_RIGHT(">>", Category.BITWISE),
    UNSIGNED_SHIFT_RIGHT(">>>", Category.BITWISE),
    NULL_COALESCE("??", Category.NULL_COALESCE);

    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL,
        BITWISE,
        NULL_COALESCE
    }

    public final String lexeme;
    public final Category category;

    IrBinaryOperator(String lexeme, Category category) {
        this.lexeme = lexeme;
        this.category = category;
    }

    /** @return the operator for {@code lexeme}, or {@code null} when it is not a binary operator */
    public static IrBinaryOperator fromLexeme(String lexeme) {
        if (lexeme == null) return null;
        String op = lexeme.trim();
        for (IrBinaryOperator o : values()) {
            if (o.lexeme.equals(op)) return o;
        }
        return null;
    }

    /**
     * Operator of a compound assignment such as {@code +=} or {@code ??=}.
     *
     * @return the underlying binary operator, or {@code null} for plain {@code =} and unknown lexemes
     */
    public static IrBinaryOperator fromCompoundAssignment(String lexeme) {
        if (lexeme == null) return null;
        String op = lexeme.trim();
        if (op.length() < 2 || !op.endsWith("=")) return null;
        IrBinaryOperator base = fromLexeme(op.substring(0, op.length() - 1));
        // "<=", ">=" and "!=" end with '=' but are comparisons, not assignments.
        if (base == null || base.category == Category.COMPARISON) return null;
        return base;
    }
}
