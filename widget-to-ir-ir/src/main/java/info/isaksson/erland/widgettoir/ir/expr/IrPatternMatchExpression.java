package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

/** {@code subject case pattern when guard}, the condition of an if-case statement or element. */
@JsonTypeName("patternMatch")
public final class IrPatternMatchExpression extends IrExpression {
    public final IrExpression subject;
    public final IrPattern pattern;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression guard;

    public IrPatternMatchExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                    IrExpression subject, IrPattern pattern, IrExpression guard) {
        super(id, location, metadata);
        this.subject = subject;
        this.pattern = pattern;
        this.guard = guard;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitPatternMatch(this);
    }

    @Override public IrPatternMatchExpression withMetadata(Map<String, Object> metadata) {
        return new IrPatternMatchExpression(id, location, metadata, subject, pattern, guard);
    }
}
