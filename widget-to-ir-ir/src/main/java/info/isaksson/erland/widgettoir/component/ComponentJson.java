package info.isaksson.erland.widgettoir.component;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import info.isaksson.erland.widgettoir.ir.IrJson;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.io.IOException;
import java.util.List;

/**
 * The documented JSON projection of component trees.
 *
 * <p>Every component becomes an object with {@code id}, {@code type} and its type-specific
 * fields; optional fields are omitted rather than written as {@code null}. Field order is fixed
 * so output is diff-friendly.</p>
 */
public final class ComponentJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ComponentJson() {}

    public static ObjectNode toJson(Component component) {
        if (component == null) throw new IllegalArgumentException("component is null");
        return component.accept(new Projection());
    }

    public static String toJsonString(Component component) throws IOException {
        return IrJson.toJsonString(toJson(component));
    }

    public static ObjectNode propertyToJson(PropertyBinding p) {
        ObjectNode o = NODES.objectNode();
        o.put("name", p.name);
        o.put("value", p.value);
        o.put("type", p.type.tag());
        if (p.carriesParameters()) {
            o.set("parameters", strings(p.parameters));
            o.put("async", p.isAsync);
        }
        if (p.component != null) o.set("component", toJson(p.component));
        return o;
    }

    public static ObjectNode locationToJson(IrSourceLocation loc) {
        ObjectNode o = NODES.objectNode();
        if (loc == null) return o;
        o.put("file", loc.file);
        o.put("line", loc.line);
        o.put("column", loc.column);
        o.put("offset", loc.offset);
        o.put("length", loc.length);
        return o;
    }

    private static ArrayNode strings(List<String> values) {
        ArrayNode a = NODES.arrayNode();
        for (String v : values) a.add(v);
        return a;
    }

    private static ArrayNode components(List<Component> values) {
        ArrayNode a = NODES.arrayNode();
        for (Component c : values) a.add(toJson(c));
        return a;
    }

    private static ObjectNode header(Component c) {
        ObjectNode o = NODES.objectNode();
        o.put("id", c.id);
        o.put("type", c.type().tag());
        return o;
    }

    private static final class Projection implements ComponentVisitor<ObjectNode> {

        @Override public ObjectNode visitWidget(WidgetComponent c) {
            ObjectNode o = header(c);
            o.put("widget", c.widgetName);
            if (c.constructorName != null) o.put("constructor", c.constructorName);
            o.put("const", c.isConst);
            ArrayNode props = NODES.arrayNode();
            for (PropertyBinding p : c.properties) props.add(propertyToJson(p));
            o.set("properties", props);
            o.set("children", components(c.children));
            o.set("location", locationToJson(c.location));
            return o;
        }

        @Override public ObjectNode visitConditional(ConditionalComponent c) {
            ObjectNode o = header(c);
            o.put("kind", c.isTernary ? "ternary" : "if");
            o.put("condition", c.conditionCode);
            if (c.thenComponent != null) o.set("then", toJson(c.thenComponent));
            if (c.elseComponent != null) o.set("else", toJson(c.elseComponent));
            o.set("location", locationToJson(c.location));
            return o;
        }

        @Override public ObjectNode visitLoop(LoopComponent c) {
            ObjectNode o = header(c);
            o.put("kind", c.loopKind);
            if (c.loopVariable != null) o.put("variable", c.loopVariable);
            if (c.iterableCode != null) o.put("iterable", c.iterableCode);
            if (c.conditionCode != null) o.put("condition", c.conditionCode);
            if (c.bodyComponent != null) o.set("body", toJson(c.bodyComponent));
            o.set("location", locationToJson(c.location));
            return o;
        }

        @Override public ObjectNode visitCollection(CollectionComponent c) {
            ObjectNode o = header(c);
            o.put("kind", c.collectionKind);
            o.set("elements", components(c.elements));
            o.put("hasSpread", c.hasSpread);
            o.set("location", locationToJson(c.location));
            return o;
        }

        @Override public ObjectNode visitBuilder(BuilderComponent c) {
            ObjectNode o = header(c);
            o.put("name", c.builderName);
            o.set("parameters", strings(c.parameters));
            o.put("async", c.isAsync);
            if (c.bodyComponent != null) o.set("body", toJson(c.bodyComponent));
            o.set("location", locationToJson(c.location));
            return o;
        }

        @Override public ObjectNode visitUnsupported(UnsupportedComponent c) {
            ObjectNode o = header(c);
            o.put("source", c.sourceCode);
            if (c.reason != null) o.put("reason", c.reason);
            o.set("location", locationToJson(c.location));
            return o;
        }

        @Override public ObjectNode visitContainerFallback(ContainerFallbackComponent c) {
            ObjectNode o = header(c);
            o.put("reason", c.reason);
            if (c.wrappedComponent != null) o.set("wrapped", toJson(c.wrappedComponent));
            o.set("location", locationToJson(c.location));
            return o;
        }
    }

    /** Lets components embedded in larger Jackson-serialized objects use this projection. */
    public static final class ComponentSerializer extends StdSerializer<Component> {

        public ComponentSerializer() {
            super(Component.class);
        }

        @Override
        public void serialize(Component value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeTree(toJson(value));
        }
    }
}
