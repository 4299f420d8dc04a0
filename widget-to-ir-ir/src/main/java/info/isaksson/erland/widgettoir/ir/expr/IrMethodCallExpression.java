package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrMaps;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/**
 * Method or function invocation. A {@code null} target means an unqualified call such as
 * {@code runApp(app)}; inside a cascade section the target is implicit and also {@code null}.
 */
@JsonTypeName("methodCall")
public final class IrMethodCallExpression extends IrExpression {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrExpression target;
    public final String methodName;
    public final List<IrExpression> arguments;
    /** Named arguments in source order. */
    public final Map<String, IrExpression> namedArguments;
    public final List<String> typeArguments;
    public final boolean nullAware;
    public final boolean cascade;

    public IrMethodCallExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                  IrExpression target, String methodName, List<IrExpression> arguments,
                                  Map<String, IrExpression> namedArguments, List<String> typeArguments,
                                  boolean nullAware, boolean cascade) {
        super(id, location, metadata);
        this.target = target;
        this.methodName = methodName;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
        this.namedArguments = IrMaps.orderedCopy(namedArguments);
        this.typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        this.nullAware = nullAware;
        this.cascade = cascade;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitMethodCall(this);
    }

    @Override public IrMethodCallExpression withMetadata(Map<String, Object> metadata) {
        return new IrMethodCallExpression(id, location, metadata, target, methodName, arguments,
                namedArguments, typeArguments, nullAware, cascade);
    }
}
