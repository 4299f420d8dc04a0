package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("conditional")
public final class IrConditionalExpression extends IrExpression {
    public final IrExpression condition;
    public final IrExpression thenExpression;
    public final IrExpression elseExpression;

    public IrConditionalExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                   IrExpression condition, IrExpression thenExpression, IrExpression elseExpression) {
        super(id, location, metadata);
        this.condition = condition;
        this.thenExpression = thenExpression;
        this.elseExpression = elseExpression;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override public IrConditionalExpression withMetadata(Map<String, Object> metadata) {
        return new IrConditionalExpression(id, location, metadata, condition, thenExpression, elseExpression);
    }
}
