package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** {@code final int a = 1, b;}; declarators keep source order. */
@JsonTypeName("variableDeclaration")
public final class IrVariableDeclarationStatement extends IrStatement {
    public final List<IrVariableDeclarator> variables;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String typeName;
    public final boolean isFinal;
    public final boolean isConst;
    public final boolean isLate;

    public IrVariableDeclarationStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                                          List<IrVariableDeclarator> variables, String typeName, boolean isFinal, boolean isConst, boolean isLate) {
        super(id, location, metadata);
        this.variables = variables == null ? List.of() : List.copyOf(variables);
        this.typeName = typeName;
        this.isFinal = isFinal;
        this.isConst = isConst;
        this.isLate = isLate;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }

    @Override public IrVariableDeclarationStatement withMetadata(Map<String, Object> metadata) {
        return new IrVariableDeclarationStatement(id, location, metadata, variables, typeName, isFinal, isConst, isLate);
    }
}
