package info.isaksson.erland.widgettoir.syntax;

public record IndexExpression(Span span, Expression target, boolean nullAware, Expression index) implements Expression {

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIndexExpression(this);
    }
}
