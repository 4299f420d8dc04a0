package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** {@code pattern when guard => result}. */
@JsonPropertyOrder({"pattern","guard","result"})
public final class IrSwitchExpressionCase {
    public final IrPattern pattern;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression guard;
    public final IrExpression result;

    public IrSwitchExpressionCase(IrPattern pattern, IrExpression guard, IrExpression result) {
        this.pattern = pattern;
        this.guard = guard;
        this.result = result;
    }
}
