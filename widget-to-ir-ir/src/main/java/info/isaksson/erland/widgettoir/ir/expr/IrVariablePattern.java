package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Set;

/** {@code var x}, {@code final int x}. */
@JsonTypeName("variable")
public final class IrVariablePattern extends IrPattern {
    public final String name;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String typeName;
    public final boolean isFinal;

    public IrVariablePattern(String id, IrSourceLocation location, String name, String typeName, boolean isFinal) {
        super(id, location);
        this.name = name;
        this.typeName = typeName;
        this.isFinal = isFinal;
    }

    @Override public Set<String> boundVariables() {
        return name == null || name.isBlank() ? Set.of() : Set.of(name);
    }
}
