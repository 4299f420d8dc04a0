package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

/** {@code return;} has a {@code null} value. */
@JsonTypeName("return")
public final class IrReturnStatement extends IrStatement {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression value;

    public IrReturnStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                             IrExpression value) {
        super(id, location, metadata);
        this.value = value;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override public IrReturnStatement withMetadata(Map<String, Object> metadata) {
        return new IrReturnStatement(id, location, metadata, value);
    }
}
