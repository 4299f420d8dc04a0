package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import info.isaksson.erland.widgettoir.ir.IrMaps;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/**
 * Normalized expression node.
 *
 * <p>The hierarchy is closed: downstream passes dispatch with {@link IrExpressionVisitor} and never
 * inspect raw operator text. Nodes are immutable; {@link #withMetadata(String, Object)} returns a
 * copy.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(IrLiteralExpression.class),
        @JsonSubTypes.Type(IrIdentifierExpression.class),
        @JsonSubTypes.Type(IrThisExpression.class),
        @JsonSubTypes.Type(IrSuperExpression.class),
        @JsonSubTypes.Type(IrBinaryExpression.class),
        @JsonSubTypes.Type(IrUnaryExpression.class),
        @JsonSubTypes.Type(IrAssignmentExpression.class),
        @JsonSubTypes.Type(IrCompoundAssignmentExpression.class),
        @JsonSubTypes.Type(IrConditionalExpression.class),
        @JsonSubTypes.Type(IrMethodCallExpression.class),
        @JsonSubTypes.Type(IrConstructorCallExpression.class),
        @JsonSubTypes.Type(IrPropertyAccessExpression.class),
        @JsonSubTypes.Type(IrIndexAccessExpression.class),
        @JsonSubTypes.Type(IrListLiteralExpression.class),
        @JsonSubTypes.Type(IrSetLiteralExpression.class),
        @JsonSubTypes.Type(IrMapLiteralExpression.class),
        @JsonSubTypes.Type(IrStringInterpolationExpression.class),
        @JsonSubTypes.Type(IrCascadeExpression.class),
        @JsonSubTypes.Type(IrNullCoalescingExpression.class),
        @JsonSubTypes.Type(IrLambdaExpression.class),
        @JsonSubTypes.Type(IrTypeCheckExpression.class),
        @JsonSubTypes.Type(IrCastExpression.class),
        @JsonSubTypes.Type(IrAwaitExpression.class),
        @JsonSubTypes.Type(IrThrowExpression.class),
        @JsonSubTypes.Type(IrSwitchExpression.class),
        @JsonSubTypes.Type(IrPatternMatchExpression.class),
        @JsonSubTypes.Type(IrSkippedElementExpression.class),
        @JsonSubTypes.Type(IrUnknownExpression.class)
})
public abstract sealed class IrExpression permits
        IrLiteralExpression, IrIdentifierExpression, IrThisExpression, IrSuperExpression,
        IrBinaryExpression, IrUnaryExpression, IrAssignmentExpression, IrCompoundAssignmentExpression,
        IrConditionalExpression, IrMethodCallExpression, IrConstructorCallExpression,
        IrPropertyAccessExpression, IrIndexAccessExpression, IrListLiteralExpression,
        IrSetLiteralExpression, IrMapLiteralExpression, IrStringInterpolationExpression,
        IrCascadeExpression, IrNullCoalescingExpression, IrLambdaExpression, IrTypeCheckExpression,
        IrCastExpression, IrAwaitExpression, IrThrowExpression, IrSwitchExpression,
        IrPatternMatchExpression, IrSkippedElementExpression, IrUnknownExpression {

    public final String id;
    public final IrSourceLocation location;

    /** Open annotations; later passes add entries through functional updates. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, Object> metadata;

    protected IrExpression(String id, IrSourceLocation location, Map<String, Object> metadata) {
        this.id = id;
        this.location = location;
        this.metadata = IrMaps.orderedCopy(metadata);
    }

    public abstract <R> R accept(IrExpressionVisitor<R> visitor);

    /** Copy of this node with the given metadata map replacing the current one. */
    public abstract IrExpression withMetadata(Map<String, Object> metadata);

    public final IrExpression withMetadata(String key, Object value) {
        return withMetadata(IrMaps.with(metadata, key, value));
    }

    public final Object metadataValue(String key) {
        return metadata.get(key);
    }

    @Override public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
