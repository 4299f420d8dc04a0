package info.isaksson.erland.widgettoir.ir.expr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.Map;

@JsonTypeName("identifier")
public final class IrIdentifierExpression extends IrExpression {
    public final String name;

    /** Library URI the identifier resolved to, when the front-end knew it. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String resolvedLibrary;

    public IrIdentifierExpression(String id, IrSourceLocation location, Map<String, Object> metadata,
                                  String name, String resolvedLibrary) {
        super(id, location, metadata);
        this.name = name;
        this.resolvedLibrary = resolvedLibrary;
    }

    @Override public <R> R accept(IrExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override public IrIdentifierExpression withMetadata(Map<String, Object> metadata) {
        return new IrIdentifierExpression(id, location, metadata, name, resolvedLibrary);
    }
}
