package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record LabeledStatement(Span span, List<String> labels, Statement statement) implements Statement {

    public LabeledStatement {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLabeledStatement(this);
    }
}
