package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** Placeholder container standing in for a subtree that was cut off, e.g. at the depth bound. */
public final class ContainerFallbackComponent extends Component {
    public final String reason;
    public final Component wrappedComponent;

    public ContainerFallbackComponent(String id, IrSourceLocation location, Map<String, Object> metadata,
                                      String reason, Component wrappedComponent) {
        super(id, location, metadata);
        this.reason = reason == null ? "" : reason;
        this.wrappedComponent = wrappedComponent;
    }

    @Override public ComponentType type() {
        return ComponentType.CONTAINER_FALLBACK;
    }

    @Override public String displayName() {
        return "Container (fallback)";
    }

    @Override public String describe() {
        return "Container (fallback: " + reason + ")";
    }

    @Override public List<Component> children() {
        return wrappedComponent == null ? List.of() : List.of(wrappedComponent);
    }

    @Override public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitContainerFallback(this);
    }

    @Override public ContainerFallbackComponent withMetadata(Map<String, Object> metadata) {
        return new ContainerFallbackComponent(id, location, metadata, reason, wrappedComponent);
    }
}
