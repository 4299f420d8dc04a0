package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/** Fallback carrying the original source text and, when known, the failure reason. */
@JsonTypeName("unknown")
public final class IrUnknownStatement extends IrStatement {
    public final String source;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String reason;

    public IrUnknownStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                              String source, String reason) {
        super(id, location, metadata);
        this.source = source == null ? "" : source;
        this.reason = reason;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitUnknown(this);
    }

    @Override public IrUnknownStatement withMetadata(Map<String, Object> metadata) {
        return new IrUnknownStatement(id, location, metadata, source, reason);
    }
}
