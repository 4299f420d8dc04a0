package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/**
 * Closure or local function inside a component tree (builder or callback). When the closure
 * returns a component-producing expression, {@link #bodyComponent} holds its extraction.
 */
public final class BuilderComponent extends Component {
    public final String builderName;
    public final List<String> parameters;
    public final boolean isAsync;
    public final Component bodyComponent;

    public BuilderComponent(String id, IrSourceLocation location, Map<String, Object> metadata,
                            String builderName, List<String> parameters, boolean isAsync, Component bodyComponent) {
        super(id, location, metadata);
        this.builderName = builderName;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.isAsync = isAsync;
        this.bodyComponent = bodyComponent;
    }

    @Override public ComponentType type() {
        return ComponentType.BUILDER;
    }

    @Override public String displayName() {
        return builderName;
    }

    @Override public String describe() {
        return builderName + "(" + String.join(", ", parameters) + ")" + (isAsync ? " async" : "");
    }

    @Override public List<Component> children() {
        return bodyComponent == null ? List.of() : List.of(bodyComponent);
    }

    @Override public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitBuilder(this);
    }

    @Override public BuilderComponent withMetadata(Map<String, Object> metadata) {
        return new BuilderComponent(id, location, metadata, builderName, parameters, isAsync, bodyComponent);
    }
}
