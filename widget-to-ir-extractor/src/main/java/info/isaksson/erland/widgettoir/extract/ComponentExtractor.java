package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.component.BuilderComponent;
import info.isaksson.erland.widgettoir.component.CollectionComponent;
import info.isaksson.erland.widgettoir.component.Component;
import info.isaksson.erland.widgettoir.component.ConditionalComponent;
import info.isaksson.erland.widgettoir.component.ContainerFallbackComponent;
import info.isaksson.erland.widgettoir.component.LoopComponent;
import info.isaksson.erland.widgettoir.component.PropertyBinding;
import info.isaksson.erland.widgettoir.component.UnsupportedComponent;
import info.isaksson.erland.widgettoir.component.WidgetComponent;
import info.isaksson.erland.widgettoir.detect.DetectorRegistry;
import info.isaksson.erland.widgettoir.ir.WidgetConventions.Properties;
import info.isaksson.erland.widgettoir.source.LocationMapper;
import info.isaksson.erland.widgettoir.syntax.Block;
import info.isaksson.erland.widgettoir.syntax.BlockFunctionBody;
import info.isaksson.erland.widgettoir.syntax.BinaryExpression;
import info.isaksson.erland.widgettoir.syntax.CascadeExpression;
import info.isaksson.erland.widgettoir.syntax.CollectionElement;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.ExpressionFunctionBody;
import info.isaksson.erland.widgettoir.syntax.ExpressionStatement;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclaration;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclarationStatement;
import info.isaksson.erland.widgettoir.syntax.FunctionExpression;
import info.isaksson.erland.widgettoir.syntax.IfElement;
import info.isaksson.erland.widgettoir.syntax.InstanceCreationExpression;
import info.isaksson.erland.widgettoir.syntax.ListLiteral;
import info.isaksson.erland.widgettoir.syntax.MapLiteralEntry;
import info.isaksson.erland.widgettoir.syntax.MethodInvocation;
import info.isaksson.erland.widgettoir.syntax.NamedExpression;
import info.isaksson.erland.widgettoir.syntax.ParenthesizedExpression;
import info.isaksson.erland.widgettoir.syntax.PropertyAccess;
import info.isaksson.erland.widgettoir.syntax.ReturnStatement;
import info.isaksson.erland.widgettoir.syntax.SpreadElement;
import info.isaksson.erland.widgettoir.syntax.Statement;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;
import info.isaksson.erland.widgettoir.syntax.SyntaxPrinter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts widget-producing syntax into a {@link Component} tree.
 *
 * <p>Classification goes through the {@link DetectorRegistry} first (widget creation, conditional,
 * loop, collection, builder, callback); shapes no detector claims are handled structurally
 * (cascades, {@code ??}, method calls and property access on a widget target, statement wrappers).
 * Anything left becomes an {@link UnsupportedComponent} carrying its source text.</p>
 *
 * <p>{@link #extract(SyntaxNode)} never throws. Recursion is bounded by {@link #maxDepth()}; the
 * node at which the bound is hit becomes a {@link ContainerFallbackComponent}.</p>
 *
 * <p>Holds per-file state (id counter, depth, statistics); not thread-safe.</p>
 */
public final class ComponentExtractor {

    public static final int DEFAULT_MAX_DEPTH = 50;
    public static final String MAX_DEPTH_REASON = "Maximum recursion depth exceeded";

    public static final String STAT_ATTEMPTS = "extract_attempts";
    public static final String STAT_SUCCESS = "extract_success";
    public static final String STAT_ERRORS = "extract_errors";
    public static final String STAT_FALLBACKS = "fallback_components";
    public static final String STAT_WIDGETS = "widgets_extracted";

    static final String CASCADE_CONDITION = "cascade";
    static final String NULL_COALESCE_CONDITION = "left ?? right";

    private final DetectorRegistry registry;
    private final LocationMapper locations;
    private final int maxDepth;

    private final Map<String, Integer> stats = new LinkedHashMap<>();
    private int depth;
    private int idCounter;

    public ComponentExtractor(DetectorRegistry registry, LocationMapper locations) {
        this(registry, locations, DEFAULT_MAX_DEPTH);
    }

    public ComponentExtractor(DetectorRegistry registry, LocationMapper locations, int maxDepth) {
        if (registry == null || locations == null) throw new IllegalArgumentException("registry and locations are required");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.registry = registry;
        this.locations = locations;
        this.maxDepth = maxDepth;
        for (String key : List.of(STAT_ATTEMPTS, STAT_SUCCESS, STAT_ERRORS, STAT_FALLBACKS, STAT_WIDGETS)) {
            stats.put(key, 0);
        }
    }

    public Component extract(SyntaxNode node) {
        if (depth >= maxDepth) return containerFallback(node, MAX_DEPTH_REASON);
        depth++;
        try {
            count(STAT_ATTEMPTS);
            if (node == null) return unsupported(null, "Node is null");
            Component component = dispatch(node);
            count(STAT_SUCCESS);
            return component;
        } catch (RuntimeException e) {
            count(STAT_ERRORS);
            return unsupported(node, "Error: " + e.getMessage());
        } finally {
            depth--;
        }
    }

    public int maxDepth() {
        return maxDepth;
    }

    /** Counters in a fixed key order. */
    public Map<String, Integer> statistics() {
        return new LinkedHashMap<>(stats);
    }

    // ---------------------------------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------------------------------

    private Component dispatch(SyntaxNode node) {
        if (registry.isWidgetCreation(node)) return widget(node);
        if (registry.isConditional(node)) return conditional(node);
        if (registry.isLoop(node)) return loop(node);
        if (registry.isCollection(node)) return collection(node);
        if (registry.isBuilder(node)) return builder(node);
        if (registry.isCallback(node)) return callback(node);
        return structural(node);
    }

    private Component structural(SyntaxNode node) {
        if (node instanceof ParenthesizedExpression p) return extract(p.expression());
        if (node instanceof CascadeExpression c) return cascade(c);
        if (node instanceof BinaryExpression b) {
            if ("??".equals(b.operator() == null ? null : b.operator().trim())) {
                Component left = extract(b.left());
                Component right = extract(b.right());
                return new ConditionalComponent(nextId("null_coalesce"), locations.locate(b), Map.of(),
                        NULL_COALESCE_CONDITION, left, right, false);
            }
            return unsupported(node, "Binary operator: " + b.operator());
        }
        if (node instanceof MethodInvocation m) {
            if (m.target() != null) return extract(m.target());
            return unsupported(node, "Method invocation: " + m.methodName());
        }
        if (node instanceof PropertyAccess p && p.target() != null) return extract(p.target());
        if (node instanceof SpreadElement s) return extract(s.expression());
        if (node instanceof ExpressionStatement s) return extract(s.expression());
        if (node instanceof ReturnStatement r) return extract(r.expression());
        if (node instanceof Block b && b.statements().size() == 1) return extract(b.statements().get(0));
        return unsupported(node, "Unknown node type: " + node.nodeType());
    }

    // ---------------------------------------------------------------------------------------------
    // Widgets and properties
    // ---------------------------------------------------------------------------------------------

    private Component widget(SyntaxNode node) {
        count(STAT_WIDGETS);
        String name = registry.getWidgetName(node);
        List<PropertyBinding> properties = new ArrayList<>();
        List<Component> children = new ArrayList<>();

        if (node instanceof InstanceCreationExpression ice) {
            for (NamedExpression arg : ice.arguments().named()) {
                String propName = arg.name();
                if (Properties.CHILD.equals(propName)) {
                    children.add(child(propName, arg.expression(), properties));
                } else if (Properties.CHILDREN.equals(propName)) {
                    children(arg.expression(), children, properties);
                } else {
                    properties.add(property(propName, arg.expression()));
                }
            }
        } else {
            // a custom detector claimed a shape of its own; trust its accessors
            properties.addAll(registry.getProperties(node));
            for (CollectionElement e : registry.getChildElements(node)) {
                children.add(extract(e));
            }
        }

        return new WidgetComponent(nextId("widget_" + name), locations.locate(node), Map.of(),
                name, registry.getConstructorName(node), registry.isConst(node), properties, children);
    }

    /** One {@code child:} value. An unsupported result also keeps the raw text as a literal property. */
    private Component child(String name, Expression value, List<PropertyBinding> properties) {
        Component c = extract(value);
        if (c instanceof UnsupportedComponent) properties.add(PropertyBinding.literal(name, source(value)));
        return c;
    }

    /** {@code children:} list; spread targets that extract to collections are flattened in place. */
    private void children(Expression value, List<Component> out, List<PropertyBinding> properties) {
        Expression v = value == null ? null : value.unparenthesized();
        if (v instanceof ListLiteral list) {
            for (CollectionElement e : list.elements()) {
                if (e instanceof SpreadElement spread) {
                    addFlattened(extract(spread.expression()), out);
                } else {
                    out.add(extract(e));
                }
            }
            return;
        }
        Component c = extract(value);
        if (c instanceof UnsupportedComponent) properties.add(PropertyBinding.literal(Properties.CHILDREN, source(value)));
        addFlattened(c, out);
    }

    private static void addFlattened(Component c, List<Component> out) {
        if (c instanceof CollectionComponent col) {
            out.addAll(col.elements);
        } else {
            out.add(c);
        }
    }

    /**
     * Callbacks first (an {@code on} or {@code Callback} name, or any non-async closure), then
     * builder names, then component-carrying names and constructor calls. Everything else is a
     * literal.
     */
    private PropertyBinding property(String name, Expression value) {
        String text = source(value);
        Expression v = value == null ? null : value.unparenthesized();
        FunctionExpression fn = v instanceof FunctionExpression f ? f : null;
        List<String> params = fn == null ? List.of() : fn.parameterNames();
        boolean async = fn != null && fn.body().isAsync();

        if (isCallback(name, fn)) return PropertyBinding.callback(name, text, params, async);
        if (isBuilderName(name, fn)) return PropertyBinding.builder(name, text, params, async);
        if (Properties.COMPONENT_CARRYING.contains(name) || v instanceof InstanceCreationExpression) {
            Component c = extract(value);
            return c instanceof UnsupportedComponent
                    ? PropertyBinding.literal(name, text)
                    : PropertyBinding.expression(name, text, c);
        }
        return PropertyBinding.literal(name, text);
    }

    static boolean isCallback(String name, FunctionExpression value) {
        return name.startsWith(Properties.CALLBACK_PREFIX)
                || name.endsWith(Properties.CALLBACK_SUFFIX)
                || (value != null && !value.body().isAsync());
    }

    static boolean isBuilderName(String name, FunctionExpression value) {
        return Properties.BUILDER.equals(name)
                || name.endsWith(Properties.BUILDER_SUFFIX)
                || (name.contains(Properties.BUILDER) && value != null);
    }

    // ---------------------------------------------------------------------------------------------
    // Control flow and collections
    // ---------------------------------------------------------------------------------------------

    private Component conditional(SyntaxNode node) {
        boolean ternary = registry.isTernary(node);
        Component then = extract(registry.getThenBranch(node));
        SyntaxNode elseNode = registry.getElseBranch(node);
        Component otherwise;
        if (elseNode != null) {
            otherwise = extract(elseNode);
        } else if (node instanceof IfElement) {
            otherwise = new CollectionComponent(nextId("collection_list"), locations.locate(node), Map.of("synthesized", true),
                    CollectionComponent.LIST, List.of(), false);
        } else {
            otherwise = null;
        }
        return new ConditionalComponent(nextId(ternary ? "conditional" : "if_conditional"), locations.locate(node), Map.of(),
                registry.getCondition(node), then, otherwise, ternary);
    }

    private Component loop(SyntaxNode node) {
        String kind = registry.getLoopKind(node);
        Component body = extract(registry.getLoopBody(node));
        return new LoopComponent(nextId("loop_" + kind), locations.locate(node), Map.of(), kind,
                registry.getLoopVariable(node), registry.getIterable(node), registry.getLoopCondition(node), body);
    }

    /** Spread targets are extracted in place (not flattened); map entries contribute their value. */
    private Component collection(SyntaxNode node) {
        String kind = registry.getCollectionKind(node);
        List<Component> elements = new ArrayList<>();
        for (CollectionElement e : registry.getCollectionElements(node)) {
            if (e instanceof SpreadElement spread) {
                elements.add(extract(spread.expression()).withMetadata("spread", true));
            } else if (e instanceof MapLiteralEntry entry) {
                elements.add(extract(entry.value()).withMetadata("mapKey", source(entry.key())));
            } else {
                elements.add(extract(e));
            }
        }
        return new CollectionComponent(nextId("collection_" + kind), locations.locate(node), Map.of(),
                kind, elements, registry.hasSpread(node));
    }

    private Component cascade(CascadeExpression node) {
        Component target = extract(node.target());
        // sections are walked for statistics and warnings but not modelled
        int sections = 0;
        for (Expression s : node.sections()) {
            extract(s);
            sections++;
        }
        return new ConditionalComponent(nextId("cascade"), locations.locate(node), Map.of("cascadeSections", sections),
                CASCADE_CONDITION, target, null, false);
    }

    // ---------------------------------------------------------------------------------------------
    // Closures
    // ---------------------------------------------------------------------------------------------

    private Component builder(SyntaxNode node) {
        String name = registry.getBuilderName(node);
        return new BuilderComponent(nextId("builder_" + name), locations.locate(node), Map.of("kind", "builder"),
                name, registry.getBuilderParameters(node), registry.isAsyncBuilder(node), body(node));
    }

    private Component callback(SyntaxNode node) {
        String name = registry.getCallbackName(node);
        return new BuilderComponent(nextId("callback_" + name), locations.locate(node), Map.of("kind", "callback"),
                name, registry.getCallbackParameters(node), registry.isAsyncBuilder(node), null);
    }

    /** Arrow body, or the value of the last {@code return} of a block body. */
    private Component body(SyntaxNode node) {
        FunctionExpression fn = null;
        if (node instanceof FunctionExpression f) fn = f;
        else if (node instanceof FunctionDeclarationStatement s && s.function() != null) fn = s.function().function();
        else if (node instanceof FunctionDeclaration d) fn = d.function();
        if (fn == null) return null;

        if (fn.body() instanceof ExpressionFunctionBody arrow) return extract(arrow.expression());
        if (fn.body() instanceof BlockFunctionBody block) {
            List<Statement> statements = block.block().statements();
            for (int i = statements.size() - 1; i >= 0; i--) {
                if (statements.get(i) instanceof ReturnStatement r && r.expression() != null) return extract(r.expression());
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------

    private Component unsupported(SyntaxNode node, String reason) {
        count(STAT_FALLBACKS);
        return new UnsupportedComponent(nextId("unsupported"), locations.locate(node), Map.of(),
                node == null ? "null" : SyntaxPrinter.print(node), reason);
    }

    private Component containerFallback(SyntaxNode node, String reason) {
        count(STAT_FALLBACKS);
        return new ContainerFallbackComponent(nextId("fallback"), locations.locate(node),
                Map.of("sourceCode", node == null ? "null" : SyntaxPrinter.print(node)), reason, null);
    }

    private String nextId(String prefix) {
        return prefix + "_" + (++idCounter);
    }

    private void count(String key) {
        stats.merge(key, 1, Integer::sum);
    }

    private static String source(Expression e) {
        return e == null ? "" : SyntaxPrinter.print(e);
    }
}
