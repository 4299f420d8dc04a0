package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("empty")
public final class IrEmptyStatement extends IrStatement {
    public IrEmptyStatement(String id, IrSourceLocation location, Map<String, Object> metadata) {
        super(id, location, metadata);
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitEmpty(this);
    }

    @Override public IrEmptyStatement withMetadata(Map<String, Object> metadata) {
        return new IrEmptyStatement(id, location, metadata);
    }
}
