package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Set;

/** Pattern shape without a dedicated node (record, object, list, logical patterns...). */
@JsonTypeName("unknown")
public final class IrUnknownPattern extends IrPattern {
    public final String source;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String reason;

    public IrUnknownPattern(String id, IrSourceLocation location, String source, String reason) {
        super(id, location);
        this.source = source == null ? "" : source;
        this.reason = reason;
    }

    @Override public Set<String> boundVariables() {
        return Set.of();
    }
}
