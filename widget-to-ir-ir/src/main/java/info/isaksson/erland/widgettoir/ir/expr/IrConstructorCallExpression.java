package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrMaps;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

@JsonTypeName("constructorCall")
public final class IrConstructorCallExpression extends IrExpression {
    public final String typeName;
    /** Named constructor, e.g. {@code symmetric} in {@code EdgeInsets.symmetric(...)}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String constructorName;
    public final List<IrExpression> arguments;
    public final Map<String, IrExpression> namedArguments;
    public final List<String> typeArguments;
    public final boolean isConst;

    public IrConstructorCallExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                       String typeName, String constructorName, List<IrExpression> arguments,
                                       Map<String, IrExpression> namedArguments, List<String> typeArguments,
                                       boolean isConst) {
        super(id, location, metadata);
        this.typeName = typeName;
        this.constructorName = constructorName;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
        this.namedArguments = IrMaps.orderedCopy(namedArguments);
        this.typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        this.isConst = isConst;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitConstructorCall(this);
    }

    @Override public IrConstructorCallExpression withMetadata(Map<String, Object> metadata) {
        return new IrConstructorCallExpression(id, location, metadata, typeName, constructorName, arguments,
                namedArguments, typeArguments, isConst);
    }
}
