package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/** {@code expression is Type} / {@code expression is! Type}. */
@JsonTypeName("typeCheck")
public final class IrTypeCheckExpression extends IrExpression {
    public final IrExpression expression;
    public final String typeName;
    public final boolean negated;

    public IrTypeCheckExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                 IrExpression expression, String typeName, boolean negated) {
        super(id, location, metadata);
        this.expression = expression;
        this.typeName = typeName;
        this.negated = negated;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitTypeCheck(this);
    }

    @Override public IrTypeCheckExpression withMetadata(Map<String, Object> metadata) {
        return new IrTypeCheckExpression(id, location, metadata, expression, typeName, negated);
    }
}
