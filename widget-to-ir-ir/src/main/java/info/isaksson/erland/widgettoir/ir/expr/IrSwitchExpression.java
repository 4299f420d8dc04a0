package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

@JsonTypeName("switch")
public final class IrSwitchExpression extends IrExpression {
    public final IrExpression subject;
    public final List<IrSwitchExpressionCase> cases;

    public IrSwitchExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                              IrExpression subject, List<IrSwitchExpressionCase> cases) {
        super(id, location, metadata);
        this.subject = subject;
        this.cases = cases == null ? List.of() : List.copyOf(cases);
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }

    @Override public IrSwitchExpression withMetadata(Map<String, Object> metadata) {
        return new IrSwitchExpression(id, location, metadata, subject, cases);
    }
}
