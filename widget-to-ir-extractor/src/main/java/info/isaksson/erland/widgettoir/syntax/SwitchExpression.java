package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record SwitchExpression(Span span, Expression subject, List<SwitchExpressionCase> cases) implements Expression {

    public SwitchExpression {
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    @Override public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSwitchExpression(this);
    }
}
