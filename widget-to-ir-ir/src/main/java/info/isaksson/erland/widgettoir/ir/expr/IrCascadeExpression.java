package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** {@code target..a()..b = c}; each section has an implicit ({@code null}) target. */
@JsonTypeName("cascade")
public final class IrCascadeExpression extends IrExpression {
    public final IrExpression target;
    public final List<IrExpression> sections;
    public final boolean nullAware;

    public IrCascadeExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                               IrExpression target, List<IrExpression> sections, boolean nullAware) {
        super(id, location, metadata);
        this.target = target;
        this.sections = sections == null ? List.of() : List.copyOf(sections);
        this.nullAware = nullAware;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitCascade(this);
    }

    @Override public IrCascadeExpression withMetadata(Map<String, Object> metadata) {
        return new IrCascadeExpression(id, location, metadata, target, sections, nullAware);
    }
}
