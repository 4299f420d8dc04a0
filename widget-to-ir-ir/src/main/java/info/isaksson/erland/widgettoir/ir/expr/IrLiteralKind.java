package info.isaksson.erland.widgettoir.ir.expr;

/** Semantic kind of a literal value. */
public enum IrLiteralKind {
    INTEGER,
    DOUBLE,
    BOOLEAN,
    STRING,
    NULL
}
