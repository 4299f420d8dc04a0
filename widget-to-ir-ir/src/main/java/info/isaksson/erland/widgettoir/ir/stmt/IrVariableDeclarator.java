package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

/** One {@code name = initializer} of a variable declaration. */
@JsonPropertyOrder({"name","initializer"})
public final class IrVariableDeclarator {
    public final String name;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression initializer;

    public IrVariableDeclarator(String name, IrExpression initializer) {
        this.name = name;
        this.initializer = initializer;
    }

    @Override public String toString() {
        return name + (initializer == null ? "" : " = " + initializer);
    }
}
