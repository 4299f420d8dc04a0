package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentTreesTest {

    private static final IrSourceLocation LOC = IrSourceLocation.unknown("lib/main.dart");

    private static WidgetComponent widget(String id, String name, List<PropertyBinding> props, Component... children) {
        return new WidgetComponent(id, LOC, Map.of(), name, null, false, props, List.of(children));
    }

    /** Scaffold(appBar: AppBar(), body: Column(children: [Text(), if (c) Icon() else <unsupported>])). */
    private static Component scaffold() {
        ConditionalComponent cond = new ConditionalComponent("if_conditional_5", LOC, Map.of(), "c",
                widget("widget_Icon_6", "Icon", null),
                new UnsupportedComponent("unsupported_7", LOC, Map.of(), "other", "Unsupported expression"), false);
        WidgetComponent column = widget("widget_Column_3", "Column", null, widget("widget_Text_4", "Text", null), cond);
        WidgetComponent appBar = widget("widget_AppBar_2", "AppBar", null);
        return widget("widget_Scaffold_1", "Scaffold", List.of(
                PropertyBinding.expression("appBar", "AppBar()", appBar),
                PropertyBinding.literal("backgroundColor", "Colors.white")), column);
    }

    @Test
    void flattenIsPreOrderWithPropertyComponentsFirst() {
        List<String> ids = ComponentTrees.flatten(scaffold()).stream().map(c -> c.id).collect(Collectors.toList());
        assertEquals(List.of("widget_Scaffold_1", "widget_AppBar_2", "widget_Column_3", "widget_Text_4",
                "if_conditional_5", "widget_Icon_6", "unsupported_7"), ids);
        assertTrue(ComponentTrees.flatten(null).isEmpty());
    }

    @Test
    void countsAndFallbacks() {
        Map<ComponentType, Integer> counts = ComponentTrees.countByType(scaffold());
        assertEquals(5, counts.get(ComponentType.WIDGET));
        assertEquals(1, counts.get(ComponentType.CONDITIONAL));
        assertEquals(1, counts.get(ComponentType.UNSUPPORTED));
        assertNull(counts.get(ComponentType.LOOP));

        List<Component> fallbacks = ComponentTrees.fallbacks(scaffold());
        assertEquals(1, fallbacks.size());
        assertEquals("unsupported_7", fallbacks.get(0).id);
    }

    @Test
    void depthCountsLevels() {
        assertEquals(0, ComponentTrees.depth(null));
        assertEquals(1, ComponentTrees.depth(widget("w", "Text", null)));
        assertEquals(4, ComponentTrees.depth(scaffold()));
    }

    @Test
    void metadataUpdatesAreCopies() {
        WidgetComponent w = widget("widget_Text_1", "Text", null);
        Component tagged = w.withMetadata("spread", true);
        assertTrue(w.metadata.isEmpty());
        assertEquals(Boolean.TRUE, tagged.metadata.get("spread"));
        assertEquals("Text", tagged.displayName());
        assertEquals(w.id, tagged.id);
    }
}
