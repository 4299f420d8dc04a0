package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record SwitchStatement(Span span, Expression expression, List<SwitchMember> members) implements Statement {

    public SwitchStatement {
        members = members == null ? List.of() : List.copyOf(members);
    }

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSwitchStatement(this);
    }
}
