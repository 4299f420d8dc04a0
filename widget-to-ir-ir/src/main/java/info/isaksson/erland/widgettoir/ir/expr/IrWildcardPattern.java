package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Set;

/** {@code _} or {@code Type _}. */
@JsonTypeName("wildcard")
public final class IrWildcardPattern extends IrPattern {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String typeName;

    public IrWildcardPattern(String id, IrSourceLocation location, String typeName) {
        super(id, location);
        this.typeName = typeName;
    }

    @Override public Set<String> boundVariables() {
        return Set.of();
    }
}
