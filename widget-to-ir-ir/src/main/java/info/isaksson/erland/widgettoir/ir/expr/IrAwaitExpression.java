package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("await")
public final class IrAwaitExpression extends IrExpression {
    public final IrExpression expression;

    public IrAwaitExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                             IrExpression expression) {
        super(id, location, metadata);
        this.expression = expression;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitAwait(this);
    }

    @Override public IrAwaitExpression withMetadata(Map<String, Object> metadata) {
        return new IrAwaitExpression(id, location, metadata, expression);
    }
}
