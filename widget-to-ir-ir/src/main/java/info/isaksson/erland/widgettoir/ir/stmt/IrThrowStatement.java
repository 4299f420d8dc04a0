package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

/** Statement-level {@code throw}; {@code rethrow} has a {@code null} exception. */
@JsonTypeName("throw")
public final class IrThrowStatement extends IrStatement {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression exception;
    public final boolean rethrow;

    public IrThrowStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                            IrExpression exception, boolean rethrow) {
        super(id, location, metadata);
        this.exception = exception;
        this.rethrow = rethrow;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitThrow(this);
    }

    @Override public IrThrowStatement withMetadata(Map<String, Object> metadata) {
        return new IrThrowStatement(id, location, metadata, exception, rethrow);
    }
}
