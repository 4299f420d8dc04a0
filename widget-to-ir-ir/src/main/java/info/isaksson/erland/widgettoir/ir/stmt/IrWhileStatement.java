package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

@JsonTypeName("while")
public final class IrWhileStatement extends IrStatement {
    public final IrExpression condition;
    public final IrStatement body;

    public IrWhileStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                            IrExpression condition, IrStatement body) {
        super(id, location, metadata);
        this.condition = condition;
        this.body = body;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override public IrWhileStatement withMetadata(Map<String, Object> metadata) {
        return new IrWhileStatement(id, location, metadata, condition, body);
    }
}
