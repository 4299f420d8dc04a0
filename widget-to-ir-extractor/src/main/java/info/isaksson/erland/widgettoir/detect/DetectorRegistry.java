package info.isaksson.erland.widgettoir.detect;

import info.isaksson.erland.widgettoir.component.CollectionComponent;
import info.isaksson.erland.widgettoir.component.LoopComponent;
import info.isaksson.erland.widgettoir.component.PropertyBinding;
import info.isaksson.erland.widgettoir.ir.WidgetConventions;
import info.isaksson.erland.widgettoir.syntax.CollectionElement;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Dispatches detection queries to registered {@link ComponentDetector}s and caches the answers.
 *
 * <p>Detectors are asked in registration order; the first answer that differs from the
 * operation's default wins. A detector that throws counts as having no answer. Every query is
 * cached under (operation, node identity) in a bounded cache that evicts its oldest entry when
 * full.</p>
 *
 * <p>Instances hold per-file state and are not thread-safe.</p>
 */
public final class DetectorRegistry {

    public static final int DEFAULT_CACHE_LIMIT = 5000;
    public static final String AST_DETECTOR = "ast";
    public static final String DEFAULT_DETECTOR = "default";

    public static final String DEFAULT_WIDGET_NAME = "Unknown";
    public static final String DEFAULT_CONDITION = "true";
    public static final String DEFAULT_BUILDER_NAME = "builder";
    public static final String DEFAULT_CALLBACK_NAME = "callback";

    private final Map<String, ComponentDetector> detectors = new LinkedHashMap<>();
    private final Set<String> knownWidgets = new LinkedHashSet<>(WidgetConventions.KNOWN_WIDGETS);
    private final LinkedHashMap<CacheKey, Object> cache = new LinkedHashMap<>();
    private final Map<DetectionOperation, Integer> operationCounts = new EnumMap<>(DetectionOperation.class);
    private final int cacheLimit;

    private int cacheHits;
    private int cacheMisses;
    private int detectorErrors;

    public DetectorRegistry() {
        this(DEFAULT_CACHE_LIMIT);
    }

    public DetectorRegistry(int cacheLimit) {
        this.cacheLimit = Math.max(1, cacheLimit);
    }

    /** Registry with the syntax-tree detector registered under {@code ast} and {@code default}. */
    public static DetectorRegistry withDefaultDetectors() {
        return withDefaultDetectors(DEFAULT_CACHE_LIMIT);
    }

    public static DetectorRegistry withDefaultDetectors(int cacheLimit) {
        DetectorRegistry registry = new DetectorRegistry(cacheLimit);
        AstComponentDetector ast = new AstComponentDetector();
        registry.registerDetector(AST_DETECTOR, ast);
        registry.registerDetector(DEFAULT_DETECTOR, ast);
        return registry;
    }

    // ---------------------------------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------------------------------

    /** Registers (or replaces) the detector for {@code key}. Replacing keeps the original position. */
    public void registerDetector(String key, ComponentDetector detector) {
        if (key == null || detector == null) throw new IllegalArgumentException("key and detector are required");
        detectors.put(key, detector);
    }

    public void registerDetectors(Map<String, ? extends ComponentDetector> detectorsByKey) {
        if (detectorsByKey == null) return;
        for (Map.Entry<String, ? extends ComponentDetector> e : detectorsByKey.entrySet()) {
            registerDetector(e.getKey(), e.getValue());
        }
    }

    public List<String> detectorKeys() {
        return List.copyOf(detectors.keySet());
    }

    public void registerWidget(String widgetName) {
        if (widgetName != null && !widgetName.isBlank()) knownWidgets.add(widgetName);
    }

    public void registerWidgets(Collection<String> widgetNames) {
        if (widgetNames == null) return;
        for (String n : widgetNames) registerWidget(n);
    }

    public boolean isKnownWidget(String widgetName) {
        return widgetName != null && knownWidgets.contains(widgetName);
    }

    public Set<String> knownWidgets() {
        return Collections.unmodifiableSet(knownWidgets);
    }

    // ---------------------------------------------------------------------------------------------
    // Cached queries
    // ---------------------------------------------------------------------------------------------

    public boolean isWidgetCreation(SyntaxNode node) {
        return query(DetectionOperation.IS_WIDGET_CREATION, node, d -> d.isWidgetCreation(node), false);
    }

    public boolean isConditional(SyntaxNode node) {
        return query(DetectionOperation.IS_CONDITIONAL, node, d -> d.isConditional(node), false);
    }

    public boolean isLoop(SyntaxNode node) {
        return query(DetectionOperation.IS_LOOP, node, d -> d.isLoop(node), false);
    }

    public boolean isCollection(SyntaxNode node) {
        return query(DetectionOperation.IS_COLLECTION, node, d -> d.isCollection(node), false);
    }

    public boolean isBuilder(SyntaxNode node) {
        return query(DetectionOperation.IS_BUILDER, node, d -> d.isBuilder(node), false);
    }

    public boolean isCallback(SyntaxNode node) {
        return query(DetectionOperation.IS_CALLBACK, node, d -> d.isCallback(node), false);
    }

    public String getWidgetName(SyntaxNode node) {
        return query(DetectionOperation.GET_WIDGET_NAME, node, d -> d.getWidgetName(node), DEFAULT_WIDGET_NAME);
    }

    public String getConstructorName(SyntaxNode node) {
        return query(DetectionOperation.GET_CONSTRUCTOR_NAME, node, d -> d.getConstructorName(node), null);
    }

    public boolean isConst(SyntaxNode node) {
        return query(DetectionOperation.IS_CONST, node, d -> d.isConst(node), false);
    }

    public List<PropertyBinding> getProperties(SyntaxNode node) {
        return query(DetectionOperation.GET_PROPERTIES, node, d -> d.getProperties(node), List.of());
    }

    public List<CollectionElement> getChildElements(SyntaxNode node) {
        return query(DetectionOperation.GET_CHILD_ELEMENTS, node, d -> d.getChildElements(node), List.of());
    }

    public String getCondition(SyntaxNode node) {
        return query(DetectionOperation.GET_CONDITION, node, d -> d.getCondition(node), DEFAULT_CONDITION);
    }

    public SyntaxNode getThenBranch(SyntaxNode node) {
        return query(DetectionOperation.GET_THEN_BRANCH, node, d -> d.getThenBranch(node), null);
    }

    public SyntaxNode getElseBranch(SyntaxNode node) {
        return query(DetectionOperation.GET_ELSE_BRANCH, node, d -> d.getElseBranch(node), null);
    }

    public boolean isTernary(SyntaxNode node) {
        return query(DetectionOperation.IS_TERNARY, node, d -> d.isTernary(node), false);
    }

    public String getLoopKind(SyntaxNode node) {
        return query(DetectionOperation.GET_LOOP_KIND, node, d -> d.getLoopKind(node), LoopComponent.FOR);
    }

    public String getLoopVariable(SyntaxNode node) {
        return query(DetectionOperation.GET_LOOP_VARIABLE, node, d -> d.getLoopVariable(node), null);
    }

    public String getIterable(SyntaxNode node) {
        return query(DetectionOperation.GET_ITERABLE, node, d -> d.getIterable(node), null);
    }

    public String getLoopCondition(SyntaxNode node) {
        return query(DetectionOperation.GET_LOOP_CONDITION, node, d -> d.getLoopCondition(node), null);
    }

    public SyntaxNode getLoopBody(SyntaxNode node) {
        return query(DetectionOperation.GET_LOOP_BODY, node, d -> d.getLoopBody(node), null);
    }

    public String getCollectionKind(SyntaxNode node) {
        return query(DetectionOperation.GET_COLLECTION_KIND, node, d -> d.getCollectionKind(node), CollectionComponent.LIST);
    }

    public boolean hasSpread(SyntaxNode node) {
        return query(DetectionOperation.HAS_SPREAD, node, d -> d.hasSpread(node), false);
    }

    public List<CollectionElement> getCollectionElements(SyntaxNode node) {
        return query(DetectionOperation.GET_COLLECTION_ELEMENTS, node, d -> d.getCollectionElements(node), List.of());
    }

    public String getBuilderName(SyntaxNode node) {
        return query(DetectionOperation.GET_BUILDER_NAME, node, d -> d.getBuilderName(node), DEFAULT_BUILDER_NAME);
    }

    public List<String> getBuilderParameters(SyntaxNode node) {
        return query(DetectionOperation.GET_BUILDER_PARAMETERS, node, d -> d.getBuilderParameters(node), List.of());
    }

    public boolean isAsyncBuilder(SyntaxNode node) {
        return query(DetectionOperation.IS_ASYNC_BUILDER, node, d -> d.isAsyncBuilder(node), false);
    }

    public String getCallbackName(SyntaxNode node) {
        return query(DetectionOperation.GET_CALLBACK_NAME, node, d -> d.getCallbackName(node), DEFAULT_CALLBACK_NAME);
    }

    public List<String> getCallbackParameters(SyntaxNode node) {
        return query(DetectionOperation.GET_CALLBACK_PARAMETERS, node, d -> d.getCallbackParameters(node), List.of());
    }

    // ---------------------------------------------------------------------------------------------
    // Cache and statistics
    // ---------------------------------------------------------------------------------------------

    /** Empties the cache and resets every counter. Registered detectors and widgets stay. */
    public void clearCache() {
        cache.clear();
        cacheHits = 0;
        cacheMisses = 0;
        detectorErrors = 0;
        operationCounts.clear();
    }

    public int cacheHits() {
        return cacheHits;
    }

    public int cacheMisses() {
        return cacheMisses;
    }

    public int cacheSize() {
        return cache.size();
    }

    public int cacheLimit() {
        return cacheLimit;
    }

    /**
     * Snapshot of the counters: known widgets, detectors, hits, misses, cache size, detector
     * errors, then one {@code op.<operation>} entry per operation issued so far.
     */
    public Map<String, Integer> statistics() {
        Map<String, Integer> out = new LinkedHashMap<>();
        out.put("known_widgets", knownWidgets.size());
        out.put("detectors", detectors.size());
        out.put("cache_hits", cacheHits);
        out.put("cache_misses", cacheMisses);
        out.put("cache_size", cache.size());
        out.put("detector_errors", detectorErrors);
        for (Map.Entry<DetectionOperation, Integer> e : operationCounts.entrySet()) {
            out.put("op." + e.getKey().key(), e.getValue());
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private <T> T query(DetectionOperation op, SyntaxNode node, Function<ComponentDetector, T> call, T defaultValue) {
        operationCounts.merge(op, 1, Integer::sum);
        CacheKey key = new CacheKey(op, node);
        if (cache.containsKey(key)) {
            cacheHits++;
            return (T) cache.get(key);
        }
        cacheMisses++;
        T result = frozen(dispatch(call, defaultValue));
        store(key, result);
        return result;
    }

    /** Cached answers are shared between callers, so list answers are handed out read-only. */
    @SuppressWarnings("unchecked")
    private static <T> T frozen(T value) {
        if (value instanceof List<?> list) {
            return (T) Collections.unmodifiableList(new ArrayList<>(list));
        }
        return value;
    }

    private <T> T dispatch(Function<ComponentDetector, T> call, T defaultValue) {
        // The same detector may sit under several keys; ask it once.
        Set<ComponentDetector> asked = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ComponentDetector detector : detectors.values()) {
            if (!asked.add(detector)) continue;
            T answer;
            try {
                answer = call.apply(detector);
            } catch (RuntimeException e) {
                detectorErrors++;
                continue;
            }
            if (isAnswer(answer, defaultValue)) return answer;
        }
        return defaultValue;
    }

    private static boolean isAnswer(Object value, Object defaultValue) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        return !value.equals(defaultValue);
    }

    private void store(CacheKey key, Object value) {
        if (cache.size() >= cacheLimit) {
            Iterator<CacheKey> it = cache.keySet().iterator();
            it.next();
            it.remove();
        }
        cache.put(key, value);
    }

    /** (operation, node identity). Two structurally equal nodes are different keys. */
    private static final class CacheKey {
        private final DetectionOperation operation;
        private final SyntaxNode node;

        CacheKey(DetectionOperation operation, SyntaxNode node) {
            this.operation = operation;
            this.node = node;
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CacheKey)) return false;
            CacheKey that = (CacheKey) o;
            return operation == that.operation && node == that.node;
        }

        @Override public int hashCode() {
            return 31 * operation.hashCode() + System.identityHashCode(node);
        }
    }
}
