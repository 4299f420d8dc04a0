package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/** {@code throw e} as an expression, or {@code rethrow} (no exception expression). */
@JsonTypeName("throw")
public final class IrThrowExpression extends IrExpression {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression exception;
    public final boolean rethrow;

    public IrThrowExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                             IrExpression exception, boolean rethrow) {
        super(id, location, metadata);
        this.exception = exception;
        this.rethrow = rethrow;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitThrow(this);
    }

    @Override public IrThrowExpression withMetadata(Map<String, Object> metadata) {
        return new IrThrowExpression(id, location, metadata, exception, rethrow);
    }
}
