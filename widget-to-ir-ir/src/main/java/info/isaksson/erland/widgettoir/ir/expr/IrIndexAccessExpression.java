package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("indexAccess")
public final class IrIndexAccessExpression extends IrExpression {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression target;
    public final IrExpression index;
    public final boolean nullAware;

    public IrIndexAccessExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                   IrExpression target, IrExpression index, boolean nullAware) {
        super(id, location, metadata);
        this.target = target;
        this.index = index;
        this.nullAware = nullAware;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitIndexAccess(this);
    }

    @Override public IrIndexAccessExpression withMetadata(Map<String, Object> metadata) {
        return new IrIndexAccessExpression(id, location, metadata, target, index, nullAware);
    }
}
