package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

@JsonTypeName("assert")
public final class IrAssertStatement extends IrStatement {
    public final IrExpression condition;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression message;

    public IrAssertStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                             IrExpression condition, IrExpression message) {
        super(id, location, metadata);
        this.condition = condition;
        this.message = message;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitAssert(this);
    }

    @Override public IrAssertStatement withMetadata(Map<String, Object> metadata) {
        return new IrAssertStatement(id, location, metadata, condition, message);
    }
}
