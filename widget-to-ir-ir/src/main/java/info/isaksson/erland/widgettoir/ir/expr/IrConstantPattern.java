package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Set;

/** Matches when the subject equals {@link #value}. */
@JsonTypeName("constant")
public final class IrConstantPattern extends IrPattern {
    public final IrExpression value;

    public IrConstantPattern(String id, IrSourceLocation location, IrExpression value) {
        super(id, location);
        this.value = value;
    }

    @Override public Set<String> boundVariables() {
        return Set.of();
    }
}
