package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("this")
public final class IrThisExpression extends IrExpression {

    public IrThisExpression(String id, IrSourceLocation location, Map<String, Object> metadata) {
        super(id, location, metadata);
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitThis(this);
    }

    @Override public IrThisExpression withMetadata(Map<String, Object> metadata) {
        return new IrThisExpression(id, location, metadata);
    }
}
