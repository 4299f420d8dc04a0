package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/**
 * Fallback for syntax the normalizer has no case for, or whose extraction failed.
 * Carries the original source text and, when known, why it could not be normalized.
 */
@JsonTypeName("unknown")
public final class IrUnknownExpression extends IrExpression {
    public final String source;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String reason;

    public IrUnknownExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                               String source, String reason) {
        super(id, location, metadata);
        this.source = source == null ? "" : source;
        this.reason = reason;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitUnknown(this);
    }

    @Override public IrUnknownExpression withMetadata(Map<String, Object> metadata) {
        return new IrUnknownExpression(id, location, metadata, source, reason);
    }
}
