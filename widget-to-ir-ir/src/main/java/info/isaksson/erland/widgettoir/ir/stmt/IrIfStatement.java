package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

/**
 * {@code if (c) ... else ...}. For {@code if (x case P when g)} the condition is an
 * {@link info.isaksson.erland.widgettoir.ir.expr.IrPatternMatchExpression}.
 */
@JsonTypeName("if")
public final class IrIfStatement extends IrStatement {
    public final IrExpression condition;
    public final IrStatement thenStatement;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrStatement elseStatement;

    public IrIfStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                         IrExpression condition, IrStatement thenStatement, IrStatement elseStatement) {
        super(id, location, metadata);
        this.condition = condition;
        this.thenStatement = thenStatement;
        this.elseStatement = elseStatement;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override public IrIfStatement withMetadata(Map<String, Object> metadata) {
        return new IrIfStatement(id, location, metadata, condition, thenStatement, elseStatement);
    }
}
