package info.isaksson.erland.widgettoir.syntax;

/** Statement shape the adapter does not model; keeps the parser's node-type name and source text. */
public record OpaqueStatement(Span span, String nodeType, String source) implements Statement {

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitOpaqueStatement(this);
    }
}
