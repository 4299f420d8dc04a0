package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** List, set or map literal whose elements are extracted as components. */
public final class CollectionComponent extends Component {
    public static final String LIST = "list";
    public static final String SET = "set";
    public static final String MAP = "map";

    public final String collectionKind;
    public final List<Component> elements;
    public final boolean hasSpread;

    public CollectionComponent(String id, IrSourceLocation location, Map<String, Object> metadata,
                               String collectionKind, List<Component> elements, boolean hasSpread) {
        super(id, location, metadata);
        this.collectionKind = collectionKind;
        this.elements = elements == null ? List.of() : List.copyOf(elements);
        this.hasSpread = hasSpread;
    }

    @Override public ComponentType type() {
        return ComponentType.COLLECTION;
    }

    @Override public String displayName() {
        return collectionKind;
    }

    @Override public String describe() {
        return collectionKind + "[" + elements.size() + " items]" + (hasSpread ? " (spread)" : "");
    }

    @Override public List<Component> children() {
        return elements;
    }

    @Override public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitCollection(this);
    }

    @Override public CollectionComponent withMetadata(Map<String, Object> metadata) {
        return new CollectionComponent(id, location, metadata, collectionKind, elements, hasSpread);
    }
}
