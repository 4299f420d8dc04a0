package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Closure or local-function parameter. */
@JsonPropertyOrder({"name","typeName","kind","defaultValue"})
public final class IrParameter {
    public final String name;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String typeName;
    public final IrParameterKind kind;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression defaultValue;

    public IrParameter(String name, String typeName, IrParameterKind kind, IrExpression defaultValue) {
        this.name = name;
        this.typeName = typeName;
        this.kind = kind == null ? IrParameterKind.POSITIONAL : kind;
        this.defaultValue = defaultValue;
    }

    /** Origin tag recorded in lambda metadata: positional, optional, named, required_named or defaulted. */
    public String originTag() {
        if (defaultValue != null) return "defaulted";
        return switch (kind) {
            case OPTIONAL_POSITIONAL -> "optional";
            case NAMED -> "named";
            case REQUIRED_NAMED -> "required_named";
            case POSITIONAL -> "positional";
        };
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrParameter)) return false;
        IrParameter that = (IrParameter) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(typeName, that.typeName) &&
                kind == that.kind &&
                Objects.equals(defaultValue, that.defaultValue);
    }

    @Override public int hashCode() {
        return Objects.hash(name, typeName, kind, defaultValue);
    }

    @Override public String toString() {
        return (typeName == null ? "" : typeName + " ") + name;
    }
}
