package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/**
 * Map literal. Elements that are not {@code key: value} entries (spreads, collection-if) are kept
 * in {@link #otherElements} so nothing from the literal is dropped.
 */
@JsonTypeName("mapLiteral")
public final class IrMapLiteralExpression extends IrExpression {
    public final List<IrMapEntry> entries;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrExpression> otherElements;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String keyType;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String valueType;
    public final boolean isConst;

    public IrMapLiteralExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                  List<IrMapEntry> entries, List<IrExpression> otherElements,
                                  String keyType, String valueType, boolean isConst) {
        super(id, location, metadata);
        this.entries = entries == null ? List.of() : List.copyOf(entries);
        this.otherElements = otherElements == null ? List.of() : List.copyOf(otherElements);
        this.keyType = keyType;
        this.valueType = valueType;
        this.isConst = isConst;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitMapLiteral(this);
    }

    @Override public IrMapLiteralExpression withMetadata(Map<String, Object> metadata) {
        return new IrMapLiteralExpression(id, location, metadata, entries, otherElements, keyType, valueType, isConst);
    }
}
