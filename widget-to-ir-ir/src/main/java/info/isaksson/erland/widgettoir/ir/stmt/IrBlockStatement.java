package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

@JsonTypeName("block")
public final class IrBlockStatement extends IrStatement {
    public final List<IrStatement> statements;

    public IrBlockStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                            List<IrStatement> statements) {
        super(id, location, metadata);
        this.statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override public IrBlockStatement withMetadata(Map<String, Object> metadata) {
        return new IrBlockStatement(id, location, metadata, statements);
    }
}
