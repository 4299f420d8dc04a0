package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;

import java.util.List;
import java.util.Map;

/** Switch statement; the default member is a case with {@code isDefault}. */
@JsonTypeName("switch")
public final class IrSwitchStatement extends IrStatement {
    public final IrExpression subject;
    public final List<IrSwitchCase> cases;

    public IrSwitchStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                             IrExpression subject, List<IrSwitchCase> cases) {
        super(id, location, metadata);
        this.subject = subject;
        this.cases = cases == null ? List.of() : List.copyOf(cases);
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }

    @Override public IrSwitchStatement withMetadata(Map<String, Object> metadata) {
        return new IrSwitchStatement(id, location, metadata, subject, cases);
    }
}
