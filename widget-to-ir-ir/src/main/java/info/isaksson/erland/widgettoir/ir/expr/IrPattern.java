package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Set;

/**
 * Pattern of a case clause, switch case or switch expression arm.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(IrWildcardPattern.class),
        @JsonSubTypes.Type(IrVariablePattern.class),
        @JsonSubTypes.Type(IrConstantPattern.class),
        @JsonSubTypes.Type(IrUnknownPattern.class)
})
public abstract sealed class IrPattern permits IrWildcardPattern, IrVariablePattern, IrConstantPattern, IrUnknownPattern {
    public final String id;
    public final IrSourceLocation location;

    protected IrPattern(String id, IrSourceLocation location) {
        this.id = id;
        this.location = location;
    }

    /** Names this pattern binds when it matches. */
    public abstract Set<String> boundVariables();
}
