package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code key: value} entry of a map literal. */
@JsonPropertyOrder({"key","value"})
public final class IrMapEntry {
    public final IrExpression key;
    public final IrExpression value;

    public IrMapEntry(IrExpression key, IrExpression value) {
        this.key = key;
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrMapEntry)) return false;
        IrMapEntry that = (IrMapEntry) o;
        return Objects.equals(key, that.key) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(key, value);
    }
}
