package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

@JsonTypeName("labeled")
public final class IrLabeledStatement extends IrStatement {
    public final List<String> labels;
    public final IrStatement statement;

    public IrLabeledStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                              List<String> labels, IrStatement statement) {
        super(id, location, metadata);
        this.labels = labels == null ? List.of() : List.copyOf(labels);
        this.statement = statement;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitLabeled(this);
    }

    @Override public IrLabeledStatement withMetadata(Map<String, Object> metadata) {
        return new IrLabeledStatement(id, location, metadata, labels, statement);
    }
}
