package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("break")
public final class IrBreakStatement extends IrStatement {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String label;

    public IrBreakStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                            String label) {
        super(id, location, metadata);
        this.label = label;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }

    @Override public IrBreakStatement withMetadata(Map<String, Object> metadata) {
        return new IrBreakStatement(id, location, metadata, label);
    }
}
