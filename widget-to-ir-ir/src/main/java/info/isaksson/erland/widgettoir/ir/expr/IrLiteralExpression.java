package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("literal")
public final class IrLiteralExpression extends IrExpression {
    /** {@link Long}, {@link Double}, {@link Boolean}, {@link String} or {@code null}. */
    public final Object value;
    public final IrLiteralKind literalKind;

    public IrLiteralExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                               Object value, IrLiteralKind literalKind) {
        super(id, location, metadata);
        this.value = value;
        this.literalKind = literalKind == null ? IrLiteralKind.NULL : literalKind;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override public IrLiteralExpression withMetadata(Map<String, Object> metadata) {
        return new IrLiteralExpression(id, location, metadata, value, literalKind);
    }
}
