package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrLambdaExpression;

import java.util.Map;

/** Local function declared inside a body. */
@JsonTypeName("functionDeclaration")
public final class IrFunctionDeclarationStatement extends IrStatement {
    public final String name;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String returnType;
    public final IrLambdaExpression function;

    public IrFunctionDeclarationStatement(String id, IrSourceLocation location, Map<String, Object> metadata,
                                          String name, String returnType, IrLambdaExpression function) {
        super(id, location, metadata);
        this.name = name;
        this.returnType = returnType;
        this.function = function;
    }

    @Override public <R> R accept(IrStatementVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }

    @Override public IrFunctionDeclarationStatement withMetadata(Map<String, Object> metadata) {
        return new IrFunctionDeclarationStatement(id, location, metadata, name, returnType, function);
    }
}
