package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/** {@code left ?? right}. */
@JsonTypeName("nullCoalescing")
public final class IrNullCoalescingExpression extends IrExpression {
    public final IrExpression left;
    public final IrExpression right;

    public IrNullCoalescingExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                      IrExpression left, IrExpression right) {
        super(id, location, metadata);
        this.left = left;
        this.right = right;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitNullCoalescing(this);
    }

    @Override public IrNullCoalescingExpression withMetadata(Map<String, Object> metadata) {
        return new IrNullCoalescingExpression(id, location, metadata, left, right);
    }
}
