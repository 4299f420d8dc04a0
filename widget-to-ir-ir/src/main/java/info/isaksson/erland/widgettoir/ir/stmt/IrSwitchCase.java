package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrPattern;

import java.util.List;

/**
 * Member of a switch statement. Classic {@code case expr:} members carry a constant pattern;
 * {@code default:} has no pattern and {@link #isDefault} set.
 */
@JsonPropertyOrder({"labels","pattern","guard","isDefault","statements"})
public final class IrSwitchCase {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> labels;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrPattern pattern;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression guard;
    public final boolean isDefault;
    public final List<IrStatement> statements;

    public IrSwitchCase(List<String> labels, IrPattern pattern, IrExpression guard, boolean isDefault,
                        List<IrStatement> statements) {
        this.labels = labels == null ? List.of() : List.copyOf(labels);
        this.pattern = pattern;
        this.guard = guard;
        this.isDefault = isDefault;
        this.statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
