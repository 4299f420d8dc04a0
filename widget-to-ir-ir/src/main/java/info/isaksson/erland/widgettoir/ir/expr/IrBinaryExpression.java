package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("binary")
public final class IrBinaryExpression extends IrExpression {
    public final IrExpression left;
    public final IrBinaryOperator operator;
    public final IrExpression right;

    public IrBinaryExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                              IrExpression left, IrBinaryOperator operator, IrExpression right) {
        super(id, location, metadata);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override public IrBinaryExpression withMetadata(Map<String, Object> metadata) {
        return new IrBinaryExpression(id, location, metadata, left, operator, right);
    }
}
