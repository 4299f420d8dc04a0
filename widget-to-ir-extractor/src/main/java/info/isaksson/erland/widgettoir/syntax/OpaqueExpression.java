package info.isaksson.erland.widgettoir.syntax;

/**
 * Expression shape the adapter does not model. Keeps the parser's own node-type name and the
 * source text so consumers can report it.
 */
public record OpaqueExpression(Span span, String nodeType, String source) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOpaqueExpression(this);
    }
}
