package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

@JsonTypeName("expressionStatement")
public final class IrExpressionStatement extends IrStatement {
    public final IrExpression expression;
    public final IrExpressionKind classification;

    public IrExpressionStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                                 IrExpression expression, IrExpressionKind classification) {
        super(id, location, metadata);
        this.expression = expression;
        this.classification = classification;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override public IrExpressionStatement withMetadata(Map<String, Object> metadata) {
        return new IrExpressionStatement(id, location, metadata, expression, classification);
    }
}
