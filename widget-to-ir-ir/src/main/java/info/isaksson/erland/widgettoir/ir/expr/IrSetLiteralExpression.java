package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

@JsonTypeName("setLiteral")
public final class IrSetLiteralExpression extends IrExpression {
    public final List<IrExpression> elements;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String elementType;
    public final boolean isConst;

    public IrSetLiteralExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                  List<IrExpression> elements, String elementType, boolean isConst) {
        super(id, location, metadata);
        this.elements = elements == null ? List.of() : List.copyOf(elements);
        this.elementType = elementType;
        this.isConst = isConst;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitSetLiteral(this);
    }

    @Override public IrSetLiteralExpression withMetadata(Map<String, Object> metadata) {
        return new IrSetLiteralExpression(id, location, metadata, elements, elementType, isConst);
    }
}
