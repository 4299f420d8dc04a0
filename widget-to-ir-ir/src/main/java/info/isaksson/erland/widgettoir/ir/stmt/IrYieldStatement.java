package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.Map;

/** {@code yield v} / {@code yield* v} inside generators. */
@JsonTypeName("yield")
public final class IrYieldStatement extends IrStatement {
    public final IrExpression value;
    public final boolean isStar;

    public IrYieldStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                            IrExpression value, boolean isStar) {
        super(id, location, metadata);
        this.value = value;
        this.isStar = isStar;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitYield(this);
    }

    @Override public IrYieldStatement withMetadata(Map<String, Object> metadata) {
        return new IrYieldStatement(id, location, metadata, value, isStar);
    }
}
