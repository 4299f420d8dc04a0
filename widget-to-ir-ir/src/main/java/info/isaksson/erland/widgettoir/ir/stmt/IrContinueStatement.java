package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("continue")
public final class IrContinueStatement extends IrStatement {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String label;

    public IrContinueStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                               String label) {
        super(id, location, metadata);
        this.label = label;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }

    @Override public IrContinueStatement withMetadata(Map<String, Object> metadata) {
        return new IrContinueStatement(id, location, metadata, label);
    }
}
