package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

@JsonTypeName("try")
public final class IrTryStatement extends IrStatement {
    public final IrBlockStatement body;
    public final List<IrCatchClause> catchClauses;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrBlockStatement finallyBlock;

    public IrTryStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                          IrBlockStatement body, List<IrCatchClause> catchClauses, IrBlockStatement finallyBlock) {
        super(id, location, metadata);
        this.body = body;
        this.catchClauses = catchClauses == null ? List.of() : List.copyOf(catchClauses);
        this.finallyBlock = finallyBlock;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitTry(this);
    }

    @Override public IrTryStatement withMetadata(Map<String, Object> metadata) {
        return new IrTryStatement(id, location, metadata, body, catchClauses, finallyBlock);
    }
}
