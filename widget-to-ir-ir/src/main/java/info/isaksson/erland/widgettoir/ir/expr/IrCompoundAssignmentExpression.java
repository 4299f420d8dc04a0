package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/** {@code target op= value}; {@link #operator} is the binary operator applied before assigning. */
@JsonTypeName("compoundAssignment")
public final class IrCompoundAssignmentExpression extends IrExpression {
    public final IrExpression target;
    public final IrBinaryOperator operator;
    public final IrExpression value;

    public IrCompoundAssignmentExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                          IrExpression target, IrBinaryOperator operator, IrExpression value) {
        super(id, location, metadata);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitCompoundAssignment(this);
    }

    @Override public IrCompoundAssignmentExpression withMetadata(Map<String, Object> metadata) {
        return new IrCompoundAssignmentExpression(id, location, metadata, target, operator, value);
    }
}
