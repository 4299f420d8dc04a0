package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

@JsonTypeName("doWhile")
public final class IrDoWhileStatement extends IrStatement {
    public final IrStatement body;
    public final IrExpression condition;

    public IrDoWhileStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                              IrStatement body, IrExpression condition) {
        super(id, location, metadata);
        this.body = body;
        this.condition = condition;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitDoWhile(this);
    }

    @Override public IrDoWhileStatement withMetadata(Map<String, Object> metadata) {
        return new IrDoWhileStatement(id, location, metadata, body, condition);
    }
}
