package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("cast")
public final class IrCastExpression extends IrExpression {
    public final IrExpression expression;
    public final String typeName;

    public IrCastExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                            IrExpression expression, String typeName) {
        super(id, location, metadata);
        this.expression = expression;
        this.typeName = typeName;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitCast(this);
    }

    @Override public IrCastExpression withMetadata(Map<String, Object> metadata) {
        return new IrCastExpression(id, location, metadata, expression, typeName);
    }
}
