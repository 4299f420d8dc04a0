package info.isaksson.erland.widgettoir.ir.expr;

/** Where a parameter sits in the declared parameter list. */
public enum IrParameterKind {
    POSITIONAL,
    OPTIONAL_POSITIONAL,
    NAMED,
    REQUIRED_NAMED
}
