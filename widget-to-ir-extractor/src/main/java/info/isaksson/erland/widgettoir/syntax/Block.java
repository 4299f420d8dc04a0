package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record Block(Span span, List<Statement> statements) implements Statement {

    public Block {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
