package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("assignment")
public final class IrAssignmentExpression extends IrExpression {
    public final IrExpression target;
    public final IrExpression value;

    public IrAssignmentExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                  IrExpression target, IrExpression value) {
        super(id, location, metadata);
        this.target = target;
        this.value = value;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override public IrAssignmentExpression withMetadata(Map<String, Object> metadata) {
        return new IrAssignmentExpression(id, location, metadata, target, value);
    }
}
