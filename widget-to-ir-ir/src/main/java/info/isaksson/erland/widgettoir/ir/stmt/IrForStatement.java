package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.List;
import java.util.Map;

/** Classic three-part {@code for}. */
@JsonTypeName("for")
public final class IrForStatement extends IrStatement {
    public final List<IrStatement> initializers;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression condition;
    public final List<IrExpression> updaters;
    public final IrStatement body;

    public IrForStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                          List<IrStatement> initializers, IrExpression condition, List<IrExpression> updaters, IrStatement body) {
        super(id, location, metadata);
        this.initializers = initializers == null ? List.of() : List.copyOf(initializers);
        this.condition = condition;
        this.updaters = updaters == null ? List.of() : List.copyOf(updaters);
        this.body = body;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override public IrForStatement withMetadata(Map<String, Object> metadata) {
        return new IrForStatement(id, location, metadata, initializers, condition, updaters, body);
    }
}
