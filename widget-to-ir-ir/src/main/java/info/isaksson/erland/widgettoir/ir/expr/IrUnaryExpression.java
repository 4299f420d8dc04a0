package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("unary")
public final class IrUnaryExpression extends IrExpression {
    public final IrUnaryOperator operator;
    public final IrExpression operand;
    /** {@code false} for postfix {@code x++}/{@code x--}. */
    public final boolean prefix;

    public IrUnaryExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                             IrUnaryOperator operator, IrExpression operand, boolean prefix) {
        super(id, location, metadata);
        this.operator = operator;
        this.operand = operand;
        this.prefix = prefix;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override public IrUnaryExpression withMetadata(Map<String, Object> metadata) {
        return new IrUnaryExpression(id, location, metadata, operator, operand, prefix);
    }
}
