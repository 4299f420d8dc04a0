package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.component.BuilderComponent;
import info.isaksson.erland.widgettoir.component.CollectionComponent;
import info.isaksson.erland.widgettoir.component.Component;
import info.isaksson.erland.widgettoir.component.ComponentJson;
import info.isaksson.erland.widgettoir.component.ComponentTrees;
import info.isaksson.erland.widgettoir.component.ComponentType;
import info.isaksson.erland.widgettoir.component.ConditionalComponent;
import info.isaksson.erland.widgettoir.component.ContainerFallbackComponent;
import info.isaksson.erland.widgettoir.component.LoopComponent;
import info.isaksson.erland.widgettoir.component.PropertyBinding;
import info.isaksson.erland.widgettoir.component.PropertyType;
import info.isaksson.erland.widgettoir.component.UnsupportedComponent;
import info.isaksson.erland.widgettoir.component.WidgetComponent;
import info.isaksson.erland.widgettoir.detect.ComponentDetector;
import info.isaksson.erland.widgettoir.detect.DetectorRegistry;
import info.isaksson.erland.widgettoir.source.LocationMapper;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.SimpleIdentifier;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static info.isaksson.erland.widgettoir.syntax.Syntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComponentExtractorTest {

    private static ComponentExtractor newExtractor() {
        return new ComponentExtractor(DetectorRegistry.withDefaultDetectors(), new LocationMapper("test.dart", ""));
    }

    /** {@code W(child: W(child: ... W()))} with {@code n} widgets. */
    private static Expression chain(int n) {
        Expression e = create("W");
        for (int i = 1; i < n; i++) {
            e = create("W", named("child", e));
        }
        return e;
    }

    @Test
    public void widgetWithLiteralPropertyAndChild() {
        Component c = newExtractor().extract(create("Box", named("color", string("red")),
                named("child", create("Label", named("text", string("hi"))))));

        WidgetComponent box = assertInstanceOf(WidgetComponent.class, c);
        assertEquals("Box", box.widgetName);
        assertEquals(1, box.properties.size());
        PropertyBinding color = box.properties.get(0);
        assertEquals("color", color.name);
        assertEquals("\"red\"", color.value);
        assertEquals(PropertyType.LITERAL, color.type);
        assertEquals(1, box.children.size());
        assertEquals("Label", assertInstanceOf(WidgetComponent.class, box.children.get(0)).widgetName);
    }

    @Test
    public void ternaryBecomesConditional() {
        Component c = newExtractor().extract(ternary(id("condition"), create("A"), create("B")));

        ConditionalComponent cond = assertInstanceOf(ConditionalComponent.class, c);
        assertTrue(cond.isTernary);
        assertEquals("condition", cond.conditionCode);
        assertEquals("A", assertInstanceOf(WidgetComponent.class, cond.thenComponent).widgetName);
        assertEquals("B", assertInstanceOf(WidgetComponent.class, cond.elseComponent).widgetName);
    }

    @Test
    public void listWithSpreadAndCollectionIf() {
        Component c = newExtractor().extract(list(create("X"), spread(id("others")), ifElement(id("flag"), create("Y"))));

        CollectionComponent col = assertInstanceOf(CollectionComponent.class, c);
        assertEquals(CollectionComponent.LIST, col.collectionKind);
        assertTrue(col.hasSpread);
        assertEquals(3, col.elements.size());
        assertEquals("X", assertInstanceOf(WidgetComponent.class, col.elements.get(0)).widgetName);

        Component spreadTarget = col.elements.get(1);
        assertEquals(Boolean.TRUE, spreadTarget.metadata.get("spread"));
        assertEquals("others", assertInstanceOf(UnsupportedComponent.class, spreadTarget).sourceCode);

        ConditionalComponent ifY = assertInstanceOf(ConditionalComponent.class, col.elements.get(2));
        assertFalse(ifY.isTernary);
        assertEquals("flag", ifY.conditionCode);
        assertEquals("Y", assertInstanceOf(WidgetComponent.class, ifY.thenComponent).widgetName);
        CollectionComponent empty = assertInstanceOf(CollectionComponent.class, ifY.elseComponent);
        assertTrue(empty.elements.isEmpty());
        assertEquals(Boolean.TRUE, empty.metadata.get("synthesized"));
    }

    @Test
    public void collectionForBecomesLoop() {
        Component c = newExtractor().extract(forIn("item", id("items"), create("Row", named("child", id("item")))));

        LoopComponent loop = assertInstanceOf(LoopComponent.class, c);
        assertEquals(LoopComponent.FOR_EACH, loop.loopKind);
        assertEquals("item", loop.loopVariable);
        assertEquals("items", loop.iterableCode);
        WidgetComponent row = assertInstanceOf(WidgetComponent.class, loop.bodyComponent);
        assertEquals("Row", row.widgetName);
        // the unsupported child keeps its text as a literal property
        assertEquals("item", row.property("child").value);
    }

    @Test
    public void fiftyNestedWidgetsExtractWithoutFallback() {
        ComponentExtractor extractor = newExtractor();
        Component root = extractor.extract(chain(50));
        assertEquals(50, ComponentTrees.flatten(root).size());
        assertTrue(ComponentTrees.fallbacks(root).isEmpty());
        assertEquals(50, extractor.statistics().get(ComponentExtractor.STAT_WIDGETS));
    }

    @Test
    public void fiftyFirstNestedWidgetFallsBack() {
        ComponentExtractor extractor = newExtractor();
        Component root = extractor.extract(chain(51));
        List<Component> all = ComponentTrees.flatten(root);
        assertEquals(51, all.size());
        ContainerFallbackComponent last = assertInstanceOf(ContainerFallbackComponent.class, all.get(50));
        assertEquals(ComponentExtractor.MAX_DEPTH_REASON, last.reason);
        assertEquals("W()", last.metadata.get("sourceCode"));
        assertEquals(1, ComponentTrees.fallbacks(root).size());
        assertEquals(1, extractor.statistics().get(ComponentExtractor.STAT_FALLBACKS));
    }

    @Test
    public void customDepthLimit() {
        ComponentExtractor extractor = new ComponentExtractor(DetectorRegistry.withDefaultDetectors(),
                new LocationMapper("test.dart", ""), 2);
        Component root = extractor.extract(chain(3));
        assertEquals(ComponentType.CONTAINER_FALLBACK, ComponentTrees.flatten(root).get(2).type());
        assertThrows(IllegalArgumentException.class,
                () -> new ComponentExtractor(DetectorRegistry.withDefaultDetectors(), new LocationMapper("t", ""), 0));
    }

    @Test
    public void outputIsDeterministic() throws Exception {
        Expression tree = create("Scaffold",
                named("appBar", create("AppBar", named("title", create("Text", string("Home"))))),
                named("body", list(create("X"), ifElement(id("flag"), create("Y"), create("Z")))),
                named("onTap", closure(params())));
        String first = ComponentJson.toJsonString(newExtractor().extract(tree));
        String second = ComponentJson.toJsonString(newExtractor().extract(tree));
        assertEquals(first, second);
    }

    @Test
    public void propertyClassification() {
        WidgetComponent w = assertInstanceOf(WidgetComponent.class, newExtractor().extract(create("ListView",
                named("onPressed", closure(params())),
                named("onChangedCallback", id("handler")),
                named("itemBuilder", asyncArrow(params("context", "i"), create("Text", id("i")))),
                named("builder", id("makeItem")),
                named("validator", arrow(params("v"), nullLiteral())),
                named("header", create("Text", string("top"))),
                named("fallback", id("placeholder")),
                named("onward", integer(1)),
                named("title", string("List")))));

        assertEquals(PropertyType.CALLBACK, w.property("onPressed").type);
        assertEquals(PropertyType.CALLBACK, w.property("onChangedCallback").type);
        PropertyBinding itemBuilder = w.property("itemBuilder");
        assertEquals(PropertyType.BUILDER, itemBuilder.type);
        assertEquals(List.of("context", "i"), itemBuilder.parameters);
        assertTrue(itemBuilder.isAsync);
        assertEquals(PropertyType.BUILDER, w.property("builder").type);
        assertEquals(PropertyType.CALLBACK, w.property("validator").type);
        PropertyBinding header = w.property("header");
        assertEquals(PropertyType.EXPRESSION, header.type);
        assertEquals("Text", assertInstanceOf(WidgetComponent.class, header.component).widgetName);
        assertEquals(PropertyType.LITERAL, w.property("fallback").type);
        assertEquals(PropertyType.CALLBACK, w.property("onward").type);
        assertEquals(PropertyType.LITERAL, w.property("title").type);
    }

    @Test
    public void synchronousClosureUnderBuilderNameIsACallback() {
        WidgetComponent layout = assertInstanceOf(WidgetComponent.class, newExtractor().extract(create("LayoutBuilder",
                named("builder", arrow(params("context"), create("Text"))),
                named("itemBuilder", arrow(params("context", "i"), create("Text", id("i")))))));

        PropertyBinding builder = layout.property("builder");
        assertEquals(PropertyType.CALLBACK, builder.type);
        assertEquals(List.of("context"), builder.parameters);
        assertFalse(builder.isAsync);
        assertEquals(PropertyType.CALLBACK, layout.property("itemBuilder").type);
    }

    @Test
    public void childrenSpreadsAreFlattened() {
        WidgetComponent column = assertInstanceOf(WidgetComponent.class, newExtractor().extract(create("Column",
                named("children", list(create("A"), spread(list(create("B"), create("C"))), spread(id("rest")))))));
        assertEquals(4, column.children.size());
        assertEquals("B", ((WidgetComponent) column.children.get(1)).widgetName);
        assertEquals("C", ((WidgetComponent) column.children.get(2)).widgetName);
        assertInstanceOf(UnsupportedComponent.class, column.children.get(3));
    }

    @Test
    public void closuresBecomeBuildersOrCallbacks() {
        ComponentExtractor extractor = newExtractor();
        BuilderComponent builder = assertInstanceOf(BuilderComponent.class,
                extractor.extract(arrow(params("context"), create("Text"))));
        assertEquals("builder", builder.metadata.get("kind"));
        assertEquals(List.of("context"), builder.parameters);
        assertEquals("Text", assertInstanceOf(WidgetComponent.class, builder.bodyComponent).widgetName);

        BuilderComponent blockBuilder = assertInstanceOf(BuilderComponent.class,
                extractor.extract(closure(params("context"), declare("x", integer(1)), ret(create("Card")))));
        assertEquals("Card", assertInstanceOf(WidgetComponent.class, blockBuilder.bodyComponent).widgetName);

        BuilderComponent callback = assertInstanceOf(BuilderComponent.class, extractor.extract(closure(params())));
        assertEquals("callback", callback.metadata.get("kind"));
        assertNull(callback.bodyComponent);
    }

    @Test
    public void cascadeWrapsItsTarget() {
        ConditionalComponent c = assertInstanceOf(ConditionalComponent.class,
                newExtractor().extract(cascade(create("Text"), cascadeCall("debug"))));
        assertEquals(ComponentExtractor.CASCADE_CONDITION, c.conditionCode);
        assertEquals(1, c.metadata.get("cascadeSections"));
        assertEquals("Text", assertInstanceOf(WidgetComponent.class, c.thenComponent).widgetName);
        assertNull(c.elseComponent);
    }

    @Test
    public void nullCoalescingBecomesConditional() {
        ConditionalComponent c = assertInstanceOf(ConditionalComponent.class,
                newExtractor().extract(binary(id("custom"), "??", create("Text"))));
        assertEquals(ComponentExtractor.NULL_COALESCE_CONDITION, c.conditionCode);
        assertFalse(c.isTernary);
        assertInstanceOf(UnsupportedComponent.class, c.thenComponent);
        assertInstanceOf(WidgetComponent.class, c.elseComponent);
    }

    @Test
    public void structuralFallbacks() {
        ComponentExtractor extractor = newExtractor();
        assertInstanceOf(WidgetComponent.class, extractor.extract(call(create("Text"), "copyWith")));
        assertInstanceOf(WidgetComponent.class, extractor.extract(paren(create("Text"))));
        assertInstanceOf(WidgetComponent.class, extractor.extract(ret(create("Text"))));

        UnsupportedComponent call = assertInstanceOf(UnsupportedComponent.class, extractor.extract(call("helper")));
        assertEquals("Method invocation: helper", call.reason);
        UnsupportedComponent plus = assertInstanceOf(UnsupportedComponent.class,
                extractor.extract(binary(integer(1), "+", integer(2))));
        assertEquals("Binary operator: +", plus.reason);
        UnsupportedComponent ident = assertInstanceOf(UnsupportedComponent.class, extractor.extract(id("x")));
        assertEquals("Unknown node type: SimpleIdentifier", ident.reason);
        UnsupportedComponent none = assertInstanceOf(UnsupportedComponent.class, extractor.extract(null));
        assertEquals("Node is null", none.reason);
    }

    @Test
    public void failureInsideExtractionIsCountedAndReplaced() {
        DetectorRegistry registry = new DetectorRegistry();
        registry.registerDetector("odd", new ComponentDetector() {
            @Override
            public Boolean isWidgetCreation(SyntaxNode node) {
                return node instanceof SimpleIdentifier;
            }

            @Override
            public List<PropertyBinding> getProperties(SyntaxNode node) {
                return Arrays.asList(PropertyBinding.literal("a", "1"), null);
            }
        });
        ComponentExtractor extractor = new ComponentExtractor(registry, new LocationMapper("t.dart", ""));

        UnsupportedComponent c = assertInstanceOf(UnsupportedComponent.class, extractor.extract(id("x")));
        assertTrue(c.reason.startsWith("Error:"));
        Map<String, Integer> stats = extractor.statistics();
        assertEquals(1, stats.get(ComponentExtractor.STAT_ATTEMPTS));
        assertEquals(0, stats.get(ComponentExtractor.STAT_SUCCESS));
        assertEquals(1, stats.get(ComponentExtractor.STAT_ERRORS));
        assertEquals(1, stats.get(ComponentExtractor.STAT_FALLBACKS));
    }

    @Test
    public void statisticsAreCountedPerCall() {
        ComponentExtractor extractor = newExtractor();
        extractor.extract(create("Box", named("child", create("Label"))));
        Map<String, Integer> stats = extractor.statistics();
        assertEquals(List.of(ComponentExtractor.STAT_ATTEMPTS, ComponentExtractor.STAT_SUCCESS,
                ComponentExtractor.STAT_ERRORS, ComponentExtractor.STAT_FALLBACKS, ComponentExtractor.STAT_WIDGETS),
                List.copyOf(stats.keySet()));
        assertEquals(2, stats.get(ComponentExtractor.STAT_ATTEMPTS));
        assertEquals(2, stats.get(ComponentExtractor.STAT_SUCCESS));
        assertEquals(2, stats.get(ComponentExtractor.STAT_WIDGETS));
        assertEquals(0, stats.get(ComponentExtractor.STAT_FALLBACKS));
    }
}
