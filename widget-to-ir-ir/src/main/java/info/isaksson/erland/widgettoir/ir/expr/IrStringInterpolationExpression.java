package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** Interpolated string; {@link #parts} keep the exact interleaving written in source. */
@JsonTypeName("stringInterpolation")
public final class IrStringInterpolationExpression extends IrExpression {
    public final List<IrInterpolationPart> parts;

    public IrStringInterpolationExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                           List<IrInterpolationPart> parts) {
        super(id, location, metadata);
        this.parts = parts == null ? List.of() : List.copyOf(parts);
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitStringInterpolation(this);
    }

    @Override public IrStringInterpolationExpression withMetadata(Map<String, Object> metadata) {
        return new IrStringInterpolationExpression(id, location, metadata, parts);
    }
}
