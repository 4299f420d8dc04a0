package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record CascadeExpression(Span span, Expression target, List<Expression> sections, boolean nullAware) implements Expression {

    public CascadeExpression {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCascadeExpression(this);
    }
}
