package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import info.isaksson.erland.widgettoir.ir.IrMaps;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/**
 * Normalized statement node. Closed hierarchy, immutable, dispatched with
 * {@link IrStatementVisitor}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(IrBlockStatement.class),
        @JsonSubTypes.Type(IrVariableDeclarationStatement.class),
        @JsonSubTypes.Type(IrExpressionStatement.class),
        @JsonSubTypes.Type(IrReturnStatement.class),
        @JsonSubTypes.Type(IrBreakStatement.class),
        @JsonSubTypes.Type(IrContinueStatement.class),
        @JsonSubTypes.Type(IrThrowStatement.class),
        @JsonSubTypes.Type(IrAssertStatement.class),
        @JsonSubTypes.Type(IrIfStatement.class),
        @JsonSubTypes.Type(IrForStatement.class),
        @JsonSubTypes.Type(IrForEachStatement.class),
        @JsonSubTypes.Type(IrWhileStatement.class),
        @JsonSubTypes.Type(IrDoWhileStatement.class),
        @JsonSubTypes.Type(IrTryStatement.class),
        @JsonSubTypes.Type(IrSwitchStatement.class),
        @JsonSubTypes.Type(IrLabeledStatement.class),
        @JsonSubTypes.Type(IrYieldStatement.class),
        @JsonSubTypes.Type(IrFunctionDeclarationStatement.class),
        @JsonSubTypes.Type(IrEmptyStatement.class),
        @JsonSubTypes.Type(IrUnknownStatement.class)
})
public abstract sealed class IrStatement permits
        IrBlockStatement, IrVariableDeclarationStatement, IrExpressionStatement, IrReturnStatement,
        IrBreakStatement, IrContinueStatement, IrThrowStatement, IrAssertStatement, IrIfStatement,
        IrForStatement, IrForEachStatement, IrWhileStatement, IrDoWhileStatement, IrTryStatement,
        IrSwitchStatement, IrLabeledStatement, IrYieldStatement, IrFunctionDeclarationStatement,
        IrEmptyStatement, IrUnknownStatement {

    public final String id;
    public final IrSourceLocation location;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, Object> metadata;

    protected IrStatement(String id, IrSourceLocation location, Map<String, Object> metadata) {
        this.id = id;
        this.location = location;
        this.metadata = IrMaps.orderedCopy(metadata);
    }

    public abstract <R> R accept(IrStatementVisitor<R> visitor);

    public abstract IrStatement withMetadata(Map<String, Object> metadata);

    public final IrStatement withMetadata(String key, Object value) {
        return withMetadata(IrMaps.with(metadata, key, value));
    }

    public final Object metadataValue(String key) {
        return metadata.get(key);
    }

    @Override public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
