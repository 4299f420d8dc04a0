package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("propertyAccess")
public final class IrPropertyAccessExpression extends IrExpression {
    /** {@code null} inside a cascade section. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression target;
    public final String propertyName;
    public final boolean nullAware;

    public IrPropertyAccessExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                      IrExpression target, String propertyName, boolean nullAware) {
        super(id, location, metadata);
        this.target = target;
        this.propertyName = propertyName;
        this.nullAware = nullAware;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitPropertyAccess(this);
    }

    @Override public IrPropertyAccessExpression withMetadata(Map<String, Object> metadata) {
        return new IrPropertyAccessExpression(id, location, metadata, target, propertyName, nullAware);
    }
}
