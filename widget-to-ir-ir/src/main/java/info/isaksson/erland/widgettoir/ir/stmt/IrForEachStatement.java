package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

/** {@code for (final x in xs)} and {@code await for}. */
@JsonTypeName("forEach")
public final class IrForEachStatement extends IrStatement {
    public final String variableName;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String variableType;
    public final IrExpression iterable;
    public final IrStatement body;
    public final boolean isAsync;

    public IrForEachStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                              String variableName, String variableType, IrExpression iterable, IrStatement body, boolean isAsync) {
        super(id, location, metadata);
        this.variableName = variableName;
        this.variableType = variableType;
        this.iterable = iterable;
        this.body = body;
        this.isAsync = isAsync;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitForEach(this);
    }

    @Override public IrForEachStatement withMetadata(Map<String, Object> metadata) {
        return new IrForEachStatement(id, location, metadata, variableName, variableType, iterable, body, isAsync);
    }
}
