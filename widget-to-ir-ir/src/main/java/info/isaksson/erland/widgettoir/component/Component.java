package info.isaksson.erland.widgettoir.component;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import info.isaksson.erland.widgettoir.ir.IrMaps;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/**
 * Node of a UI component tree: a structured view of a widget-producing expression, parallel to
 * (but separate from) the statement/expression IR.
 *
 * <p>Components are immutable and their child lists keep source order. JSON output follows the
 * projection written by {@link ComponentJson}.</p>
 */
@JsonSerialize(using = ComponentJson.ComponentSerializer.class)
public abstract sealed class Component permits
        WidgetComponent, ConditionalComponent, LoopComponent, CollectionComponent,
        BuilderComponent, UnsupportedComponent, ContainerFallbackComponent {

    public final String id;
    public final IrSourceLocation location;
    public final Map<String, Object> metadata;

    protected Component(String id, IrSourceLocation location, Map<String, Object> metadata) {
        this.id = id;
        this.location = location;
        this.metadata = IrMaps.orderedCopy(metadata);
    }

    public abstract ComponentType type();

    /** Short label: the widget name, {@code ternary}/{@code if}, the loop or collection kind... */
    public abstract String displayName();

    /** One-line human readable summary. */
    public abstract String describe();

    /** Direct sub-components in source order. */
    public abstract List<Component> children();

    public abstract <R> R accept(ComponentVisitor<R> visitor);

    public abstract Component withMetadata(Map<String, Object> metadata);

    public final Component withMetadata(String key, Object value) {
        return withMetadata(IrMaps.with(metadata, key, value));
    }

    @Override public String toString() {
        return id + " " + describe();
    }
}
