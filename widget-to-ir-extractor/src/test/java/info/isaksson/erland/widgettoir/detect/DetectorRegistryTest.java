package info.isaksson.erland.widgettoir.detect;

import info.isaksson.erland.widgettoir.component.CollectionComponent;
import info.isaksson.erland.widgettoir.component.LoopComponent;
import info.isaksson.erland.widgettoir.component.PropertyBinding;
import info.isaksson.erland.widgettoir.syntax.InstanceCreationExpression;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static info.isaksson.erland.widgettoir.syntax.Syntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class DetectorRegistryTest {

    @Test
    public void secondIdenticalQueryIsACacheHit() {
        DetectorRegistry registry = DetectorRegistry.withDefaultDetectors();
        InstanceCreationExpression text = create("Text", string("hi"));

        assertTrue(registry.isWidgetCreation(text));
        int hits = registry.cacheHits();
        int misses = registry.cacheMisses();

        assertTrue(registry.isWidgetCreation(text));
        assertEquals(hits + 1, registry.cacheHits());
        assertEquals(misses, registry.cacheMisses());
    }

    @Test
    public void structurallyEqualNodesAreCachedSeparately() {
        DetectorRegistry registry = DetectorRegistry.withDefaultDetectors();
        registry.getWidgetName(create("Text"));
        registry.getWidgetName(create("Text"));
        assertEquals(0, registry.cacheHits());
        assertEquals(2, registry.cacheMisses());
        assertEquals(2, registry.cacheSize());
    }

    @Test
    public void oldestEntryIsEvictedWhenFull() {
        DetectorRegistry registry = DetectorRegistry.withDefaultDetectors(2);
        SyntaxNode a = create("A");
        SyntaxNode b = create("B");
        SyntaxNode c = create("C");
        registry.isWidgetCreation(a);
        registry.isWidgetCreation(b);
        registry.isWidgetCreation(c);
        assertEquals(2, registry.cacheSize());

        registry.isWidgetCreation(c);
        assertEquals(1, registry.cacheHits());
        registry.isWidgetCreation(a);
        assertEquals(1, registry.cacheHits(), "a was evicted");
        assertEquals(4, registry.cacheMisses());
    }

    @Test
    public void clearCacheResetsCounters() {
        DetectorRegistry registry = DetectorRegistry.withDefaultDetectors();
        SyntaxNode n = create("Text");
        registry.isWidgetCreation(n);
        registry.isWidgetCreation(n);
        registry.clearCache();
        assertEquals(0, registry.cacheHits());
        assertEquals(0, registry.cacheMisses());
        assertEquals(0, registry.cacheSize());
        assertEquals(List.of(DetectorRegistry.AST_DETECTOR, DetectorRegistry.DEFAULT_DETECTOR), registry.detectorKeys());
    }

    @Test
    public void throwingDetectorCountsAsNoAnswer() {
        DetectorRegistry registry = new DetectorRegistry();
        registry.registerDetector("broken", new ComponentDetector() {
            @Override
            public Boolean isWidgetCreation(SyntaxNode node) {
                throw new IllegalStateException("boom");
            }
        });
        registry.registerDetector(DetectorRegistry.AST_DETECTOR, new AstComponentDetector());

        assertTrue(registry.isWidgetCreation(create("Text")));
        assertEquals(1, registry.statistics().get("detector_errors"));
    }

    @Test
    public void firstDetectorWithAnAnswerWins() {
        DetectorRegistry registry = new DetectorRegistry();
        registry.registerDetector("custom", new ComponentDetector() {
            @Override
            public String getWidgetName(SyntaxNode node) {
                return "Custom";
            }
        });
        registry.registerDetector(DetectorRegistry.AST_DETECTOR, new AstComponentDetector());
        assertEquals("Custom", registry.getWidgetName(create("Text")));
    }

    @Test
    public void defaultsWithoutDetectors() {
        DetectorRegistry registry = new DetectorRegistry();
        SyntaxNode n = id("x");
        assertFalse(registry.isWidgetCreation(n));
        assertEquals(DetectorRegistry.DEFAULT_WIDGET_NAME, registry.getWidgetName(n));
        assertEquals(DetectorRegistry.DEFAULT_CONDITION, registry.getCondition(n));
        assertEquals(DetectorRegistry.DEFAULT_BUILDER_NAME, registry.getBuilderName(n));
        assertEquals(DetectorRegistry.DEFAULT_CALLBACK_NAME, registry.getCallbackName(n));
        assertEquals(List.of(), registry.getProperties(n));
        assertEquals(List.of(), registry.getChildElements(n));
        assertNull(registry.getThenBranch(n));
    }

    @Test
    public void astDetectorClassifiesShapes() {
        DetectorRegistry registry = DetectorRegistry.withDefaultDetectors();
        assertTrue(registry.isConditional(ternary(id("a"), create("A"), create("B"))));
        assertTrue(registry.isLoop(forIn("item", id("items"), create("Text", id("item")))));
        assertEquals(LoopComponent.FOR_EACH, registry.getLoopKind(forIn("item", id("items"), id("item"))));
        assertEquals(CollectionComponent.LIST, registry.getCollectionKind(list(id("a"))));
        assertTrue(registry.hasSpread(list(spread(id("rest")))));
        assertTrue(registry.isBuilder(arrow(params("context"), create("Text"))));
        assertFalse(registry.isBuilder(arrow(params(), create("Text"))));
        assertTrue(registry.isCallback(closure(params())));
        assertEquals("Icons.add", registry.getProperties(create("Icon", named("icon", prefixed("Icons", "add")))).get(0).value);
    }

    @Test
    public void knownWidgetsIncludeFrameworkAndRegisteredNames() {
        DetectorRegistry registry = new DetectorRegistry();
        assertTrue(registry.isKnownWidget("Scaffold"));
        assertFalse(registry.isKnownWidget("MyCard"));
        registry.registerWidgets(List.of("MyCard", " "));
        assertTrue(registry.isKnownWidget("MyCard"));
        assertFalse(registry.isKnownWidget(" "));
    }

    @Test
    public void statisticsCountOperations() {
        DetectorRegistry registry = DetectorRegistry.withDefaultDetectors();
        SyntaxNode n = create("Text");
        registry.isWidgetCreation(n);
        registry.isWidgetCreation(n);
        registry.getWidgetName(n);
        Map<String, Integer> stats = registry.statistics();
        assertEquals(2, stats.get("detectors"));
        assertEquals(1, stats.get("cache_hits"));
        assertEquals(2, stats.get("cache_misses"));
        assertEquals(2, stats.get("op.isWidgetCreation"));
        assertEquals(1, stats.get("op.getWidgetName"));
    }

    @Test
    public void cachedListAnswersCannotBeChangedByCallers() {
        DetectorRegistry registry = DetectorRegistry.withDefaultDetectors();
        SyntaxNode node = create("Container", named("color", string("red")));

        List<PropertyBinding> first = registry.getProperties(node);
        assertEquals(1, first.size());
        assertThrows(UnsupportedOperationException.class, first::clear);

        List<PropertyBinding> second = registry.getProperties(node);
        assertEquals(1, registry.cacheHits());
        assertEquals(1, second.size());
        assertEquals("color", second.get(0).name);

        SyntaxNode builder = arrow(params("context", "index"), create("Text"));
        List<String> parameters = registry.getBuilderParameters(builder);
        assertThrows(UnsupportedOperationException.class, () -> parameters.add("extra"));
        assertEquals(List.of("context", "index"), registry.getBuilderParameters(builder));
    }

    @Test
    public void nullDetectorIsRejected() {
        DetectorRegistry registry = new DetectorRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.registerDetector("x", null));
    }
}
