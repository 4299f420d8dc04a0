package info.isaksson.erland.widgettoir.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.widgettoir.ir.IrJson;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentJsonTest {

    private static final IrSourceLocation LOC = new IrSourceLocation("lib/main.dart", 10, 3, 120, 40);

    private static List<String> fieldNames(JsonNode node) {
        List<String> out = new ArrayList<>();
        for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) out.add(it.next());
        return out;
    }

    private static WidgetComponent text(String id) {
        return new WidgetComponent(id, LOC, Map.of(), "Text", null, true,
                List.of(PropertyBinding.literal("style", "theme.title")), List.of());
    }

    @Test
    void widgetFieldsHaveAFixedOrder() {
        WidgetComponent column = new WidgetComponent("widget_Column_1", LOC, Map.of(), "Column", null, false,
                List.of(PropertyBinding.literal("mainAxisSize", "MainAxisSize.min")), List.of(text("widget_Text_2")));
        ObjectNode json = ComponentJson.toJson(column);

        assertEquals(List.of("id", "type", "widget", "const", "properties", "children", "location"), fieldNames(json));
        assertEquals("widget", json.get("type").asText());
        assertEquals("Text", json.get("children").get(0).get("widget").asText());
        assertTrue(json.get("children").get(0).get("const").asBoolean());
        assertEquals(120, json.get("location").get("offset").asInt());

        WidgetComponent named = new WidgetComponent("widget_Padding_3", LOC, Map.of(), "Padding", "only", false, null, null);
        assertEquals(List.of("id", "type", "widget", "constructor", "const", "properties", "children", "location"),
                fieldNames(ComponentJson.toJson(named)));
    }

    @Test
    void propertiesProjectByBindingType() {
        ObjectNode literal = ComponentJson.propertyToJson(PropertyBinding.literal("color", "Colors.red"));
        assertEquals(List.of("name", "value", "type"), fieldNames(literal));
        assertEquals("literal", literal.get("type").asText());

        ObjectNode callback = ComponentJson.propertyToJson(
                PropertyBinding.callback("onPressed", "() async { await save(); }", List.of(), true));
        assertEquals(List.of("name", "value", "type", "parameters", "async"), fieldNames(callback));
        assertTrue(callback.get("async").asBoolean());

        ObjectNode builder = ComponentJson.propertyToJson(
                PropertyBinding.builder("itemBuilder", "(context, i) => Row()", List.of("context", "i"), false));
        assertEquals("builder", builder.get("type").asText());
        assertEquals(2, builder.get("parameters").size());

        ObjectNode nested = ComponentJson.propertyToJson(
                PropertyBinding.expression("appBar", "AppBar()", text("widget_Text_1")));
        assertEquals("expression", nested.get("type").asText());
        assertEquals("Text", nested.get("component").get("widget").asText());
    }

    @Test
    void optionalFieldsAreOmitted() {
        ConditionalComponent ifOnly = new ConditionalComponent("if_conditional_1", LOC, Map.of(), "loggedIn",
                text("widget_Text_2"), null, false);
        ObjectNode json = ComponentJson.toJson(ifOnly);
        assertEquals("if", json.get("kind").asText());
        assertTrue(json.has("then"));
        assertFalse(json.has("else"));

        LoopComponent loop = new LoopComponent("loop_forEach_3", LOC, Map.of(), LoopComponent.FOR_EACH,
                "item", "items", null, null);
        assertEquals(List.of("id", "type", "kind", "variable", "iterable", "location"),
                fieldNames(ComponentJson.toJson(loop)));

        UnsupportedComponent unsupported = new UnsupportedComponent("unsupported_4", LOC, Map.of(), "widgets[0]", null);
        assertFalse(ComponentJson.toJson(unsupported).has("reason"));

        ContainerFallbackComponent fallback = new ContainerFallbackComponent("fallback_5", LOC, Map.of(), "Too deep", null);
        ObjectNode fb = ComponentJson.toJson(fallback);
        assertEquals("container_fallback", fb.get("type").asText());
        assertFalse(fb.has("wrapped"));
    }

    @Test
    void collectionsAndBuilders() {
        CollectionComponent list = new CollectionComponent("collection_list_1", LOC, Map.of(), CollectionComponent.LIST,
                List.of(text("widget_Text_2")), true);
        ObjectNode json = ComponentJson.toJson(list);
        assertEquals("list", json.get("kind").asText());
        assertTrue(json.get("hasSpread").asBoolean());

        BuilderComponent builder = new BuilderComponent("builder_itemBuilder_3", LOC, Map.of(), "itemBuilder",
                List.of("context", "index"), false, text("widget_Text_4"));
        ObjectNode b = ComponentJson.toJson(builder);
        assertEquals("itemBuilder", b.get("name").asText());
        assertEquals("Text", b.get("body").get("widget").asText());
    }

    @Test
    void componentsInsideJacksonBeansUseTheProjection() throws Exception {
        String json = IrJson.toJsonString(List.of(text("widget_Text_1")));
        JsonNode tree = IrJson.readTree(json);
        assertEquals("Text", tree.get(0).get("widget").asText());
        assertFalse(tree.get(0).has("metadata"));
        assertEquals(json, IrJson.toJsonString(List.of(text("widget_Text_1"))));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> ComponentJson.toJson(null));
    }
}
