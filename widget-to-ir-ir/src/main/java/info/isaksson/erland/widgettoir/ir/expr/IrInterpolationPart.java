package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One part of an interpolated string: literal text or an embedded expression. */
@JsonPropertyOrder({"text","expression"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrInterpolationPart {
    public final String text;
    public final IrExpression expression;

    private IrInterpolationPart(String text, IrExpression expression) {
        this.text = text;
        this.expression = expression;
    }

    public static IrInterpolationPart text(String text) {
        return new IrInterpolationPart(text == null ? "" : text, null);
    }

    public static IrInterpolationPart expression(IrExpression expression) {
        return new IrInterpolationPart(null, expression);
    }

    public boolean holdsText() {
        return expression == null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrInterpolationPart)) return false;
        IrInterpolationPart that = (IrInterpolationPart) o;
        return Objects.equals(text, that.text) && Objects.equals(expression, that.expression);
    }

    @Override public int hashCode() {
        return Objects.hash(text, expression);
    }

    @Override public String toString() {
        return holdsText() ? "text(" + text + ")" : "expr(" + expression + ")";
    }
}
