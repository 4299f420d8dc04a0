package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;

import java.util.List;
import java.util.Map;

/**
 * Closure / function literal. An arrow body ({@code => expr}) is normalized into a single
 * return statement, so {@link #body} is always a statement list.
 */
@JsonTypeName("lambda")
public final class IrLambdaExpression extends IrExpression {
    /** Marker used when no return type could be inferred. */
    public static final String UNTYPED = "void";

    public final List<IrParameter> parameters;
    public final List<IrStatement> body;
    public final boolean isAsync;
    public final boolean isGenerator;
    public final boolean isArrow;
    public final String inferredReturnType;

    public IrLambdaExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                              List<IrParameter> parameters, List<IrStatement> body,
                              boolean isAsync, boolean isGenerator, boolean isArrow, String inferredReturnType) {
        super(id, location, metadata);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.body = body == null ? List.of() : List.copyOf(body);
        this.isAsync = isAsync;
        this.isGenerator = isGenerator;
        this.isArrow = isArrow;
        this.inferredReturnType = inferredReturnType == null ? UNTYPED : inferredReturnType;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }

    @Override public IrLambdaExpression withMetadata(Map<String, Object> metadata) {
        return new IrLambdaExpression(id, location, metadata, parameters, body, isAsync, isGenerator, isArrow,
                inferredReturnType);
    }
}
