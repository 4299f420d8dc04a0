package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/**
 * Placeholder for a collection element the IR does not model (a {@code for} comprehension).
 * The enclosing literal keeps its other elements.
 */
@JsonTypeName("skippedElement")
public final class IrSkippedElementExpression extends IrExpression {
    public final String source;
    public final String reason;

    public IrSkippedElementExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                      String source, String reason) {
        super(id, location, metadata);
        this.source = source == null ? "" : source;
        this.reason = reason == null ? "" : reason;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitSkippedElement(this);
    }

    @Override public IrSkippedElementExpression withMetadata(Map<String, Object> metadata) {
        return new IrSkippedElementExpression(id, location, metadata, source, reason);
    }
}
