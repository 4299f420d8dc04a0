package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("super")
public final class IrSuperExpression extends IrExpression {

    public IrSuperExpression(String id, IrSourceLocation location, Map<String, Object> metadata) {
        super(id, location, metadata);
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitSuper(this);
    }

    @Override public IrSuperExpression withMetadata(Map<String, Object> metadata) {
        return new IrSuperExpression(id, location, metadata);
    }
}
