package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** Constructor call of a widget type, e.g. {@code Padding(padding: ..., child: Text('x'))}. */
public final class WidgetComponent extends Component {
    public final String widgetName;
    /** Named constructor ({@code ListView.builder}), or {@code null}. */
    public final String constructorName;
    public final boolean isConst;
    public final List<PropertyBinding> properties;
    public final List<Component> children;

    public WidgetComponent(String id, IrSourceLocation location, Map<String, Object> metadata,
                           String widgetName, String constructorName, boolean isConst,
                           List<PropertyBinding> properties, List<Component> children) {
        super(id, location, metadata);
        this.widgetName = widgetName;
        this.constructorName = constructorName;
        this.isConst = isConst;
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public PropertyBinding property(String name) {
        for (PropertyBinding p : properties) {
            if (p.name.equals(name)) return p;
        }
        return null;
    }

    @Override public ComponentType type() {
        return ComponentType.WIDGET;
    }

    @Override public String displayName() {
        return widgetName;
    }

    @Override public String describe() {
        String ctor = constructorName != null ? "." + constructorName : "";
        String count = children.isEmpty() ? "" : " (" + children.size() + " children)";
        return widgetName + ctor + count;
    }

    @Override public List<Component> children() {
        return children;
    }

    @Override public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitWidget(this);
    }

    @Override public WidgetComponent withMetadata(Map<String, Object> metadata) {
        return new WidgetComponent(id, location, metadata, widgetName, constructorName, isConst, properties, children);
    }
}
