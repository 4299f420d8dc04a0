package info.isaksson.erland.widgettoir.core;

import info.isaksson.erland.widgettoir.component.Component;
import info.isaksson.erland.widgettoir.component.ComponentTrees;
import info.isaksson.erland.widgettoir.component.ContainerFallbackComponent;
import info.isaksson.erland.widgettoir.component.UnsupportedComponent;
import info.isaksson.erland.widgettoir.detect.DetectorRegistry;
import info.isaksson.erland.widgettoir.element.Element;
import info.isaksson.erland.widgettoir.extract.ComponentExtractor;
import info.isaksson.erland.widgettoir.extract.IrExtractor;
import info.isaksson.erland.widgettoir.extract.IrIdGenerator;
import info.isaksson.erland.widgettoir.extract.ReturnedExpressions;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.WidgetConventions;
import info.isaksson.erland.widgettoir.ir.expr.IrUnknownExpression;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrUnknownStatement;
import info.isaksson.erland.widgettoir.resolve.WidgetProducerResolver;
import info.isaksson.erland.widgettoir.source.LocationMapper;
import info.isaksson.erland.widgettoir.syntax.ClassDeclaration;
import info.isaksson.erland.widgettoir.syntax.ConstructorDeclaration;
import info.isaksson.erland.widgettoir.syntax.Declaration;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.FieldDeclaration;
import info.isaksson.erland.widgettoir.syntax.FunctionBody;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclaration;
import info.isaksson.erland.widgettoir.syntax.MethodDeclaration;
import info.isaksson.erland.widgettoir.syntax.TopLevelVariableDeclaration;
import info.isaksson.erland.widgettoir.syntax.VariableDeclaration;
import info.isaksson.erland.widgettoir.syntax.VariableDeclarationList;

import java.util.ArrayList;
import java.util.List;

/**
 * Core API: turns one parsed file into declaration records, IR bodies and component trees.
 *
 * <p>Every call allocates a fresh location mapper, id generator, detector registry, resolver,
 * normalizer and component extractor, so files never share caches or counters. Callers that
 * process many files in parallel may share one service instance.</p>
 */
public final class WidgetToIrService {

    public WidgetToIrResult extractFile(FileInput input, WidgetToIrOptions options) {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (options == null) options = new WidgetToIrOptions();
        return new FileRun(input, options).run();
    }

    /** Per-file state of one {@link #extractFile} call. */
    private static final class FileRun {
        private final FileInput input;
        private final WidgetToIrOptions options;
        private final LocationMapper locations;
        private final IrIdGenerator ids;
        private final DetectorRegistry registry;
        private final WidgetProducerResolver resolver;
        private final IrExtractor ir;
        private final ComponentExtractor components;
        private final ExtractionWarnings warnings = new ExtractionWarnings();
        private final List<DeclarationRecord> records = new ArrayList<>();

        FileRun(FileInput input, WidgetToIrOptions options) {
            this.input = input;
            this.options = options;
            this.locations = new LocationMapper(input.filePath, input.content);
            this.ids = new IrIdGenerator(input.filePath);
            this.registry = DetectorRegistry.withDefaultDetectors(options.detectionCacheLimit);
            if (options.additionalKnownWidgets != null) registry.registerWidgets(options.additionalKnownWidgets);
            this.resolver = new WidgetProducerResolver(options.frameworkLibraryUri);
            this.ir = new IrExtractor(locations, ids);
            this.components = new ComponentExtractor(registry, locations, options.maxRecursionDepth);
        }

        WidgetToIrResult run() {
            for (Declaration d : input.unit.declarations()) {
                declaration(d, null);
            }
            for (IrUnknownExpression u : ir.unknownExpressions()) {
                warnings.warn(ExtractionWarnings.UNKNOWN_EXPRESSION, u.reason, u.location, "node", u.id);
            }
            for (IrUnknownStatement u : ir.unknownStatements()) {
                warnings.warn(ExtractionWarnings.UNKNOWN_STATEMENT, u.reason, u.location, "node", u.id);
            }
            return new WidgetToIrResult(input.filePath, ids.contextHash(), records,
                    warnings.toDeterministicList(), registry.statistics(), components.statistics());
        }

        private void declaration(Declaration d, String parent) {
            if (d instanceof ClassDeclaration c) {
                classDeclaration(c, parent);
            } else if (d instanceof MethodDeclaration m) {
                DeclarationKind kind = m.isGetter() ? DeclarationKind.GETTER
                        : m.isSetter() ? DeclarationKind.SETTER : DeclarationKind.METHOD;
                executable(kind, m, m.name(), parent, m.returnType(), m.body());
            } else if (d instanceof FunctionDeclaration f) {
                DeclarationKind kind = "get".equals(f.propertyKeyword()) ? DeclarationKind.GETTER
                        : "set".equals(f.propertyKeyword()) ? DeclarationKind.SETTER : DeclarationKind.FUNCTION;
                executable(kind, f, f.name(), parent, f.returnType(), f.function() == null ? null : f.function().body());
            } else if (d instanceof ConstructorDeclaration c) {
                constructor(c, parent);
            } else if (d instanceof FieldDeclaration f) {
                variables(DeclarationKind.FIELD, f, parent, f.fields());
            } else if (d instanceof TopLevelVariableDeclaration v) {
                variables(DeclarationKind.TOP_LEVEL_VARIABLE, v, parent, v.variables());
            }
        }

        private void classDeclaration(ClassDeclaration c, String parent) {
            boolean produces = producesWidget(c, parent, c.superclass(), true);
            records.add(new DeclarationRecord(DeclarationKind.CLASS, c.name(), parent, locations.locate(c),
                    produces, c.element() != null, List.of(), List.of(), List.of()));
            String qualified = parent == null ? c.name() : parent + "." + c.name();
            for (Declaration member : c.members()) {
                declaration(member, qualified);
            }
        }

        private void executable(DeclarationKind kind, Declaration d, String name, String parent,
                                String returnType, FunctionBody body) {
            boolean produces = producesWidget(d, parent, returnType, false);
            List<IrStatement> statements = options.includeBodies ? ir.extractBodyStatements(body) : List.of();
            List<Component> trees = new ArrayList<>();
            if (produces && options.extractComponents) {
                for (Expression e : ReturnedExpressions.of(body)) {
                    trees.add(tree(e, qualifiedName(parent, name)));
                }
            }
            records.add(new DeclarationRecord(kind, name, parent, locations.locate(d), produces,
                    d.element() != null, List.of(), statements, trees));
        }

        private void constructor(ConstructorDeclaration c, String parent) {
            boolean produces = producesWidget(c, parent, c.className(), true);
            List<IrStatement> initializers = options.includeBodies ? ir.extractConstructorInitializers(c) : List.of();
            List<IrStatement> statements = options.includeBodies ? ir.extractBodyStatements(c.body()) : List.of();
            records.add(new DeclarationRecord(DeclarationKind.CONSTRUCTOR, c.name(), parent, locations.locate(c),
                    produces, c.element() != null, initializers, statements, List.of()));
        }

        private void variables(DeclarationKind kind, Declaration d, String parent, VariableDeclarationList list) {
            String type = list == null ? null : list.type();
            boolean produces = producesWidget(d, parent, type, false);
            List<IrStatement> statements = options.includeBodies && list != null
                    ? List.of(ir.extractVariables(list)) : List.of();
            List<Component> trees = new ArrayList<>();
            if (produces && options.extractComponents && list != null) {
                for (VariableDeclaration v : list.variables()) {
                    if (v.initializer() != null) trees.add(tree(v.initializer(), qualifiedName(parent, v.name())));
                }
            }
            records.add(new DeclarationRecord(kind, d.name(), parent, locations.locate(d), produces,
                    d.element() != null, List.of(), statements, trees));
        }

        private Component tree(Expression e, String declaration) {
            Component root = components.extract(e);
            for (Component c : ComponentTrees.fallbacks(root)) {
                if (c instanceof UnsupportedComponent u) {
                    warnings.warn(ExtractionWarnings.UNSUPPORTED_COMPONENT,
                            u.reason == null ? "Unsupported component" : u.reason, u.location,
                            "declaration", declaration, "component", u.id);
                } else if (c instanceof ContainerFallbackComponent f) {
                    warnings.warn(ExtractionWarnings.COMPONENT_FALLBACK, f.reason, f.location,
                            "declaration", declaration, "component", f.id);
                }
            }
            return root;
        }

        /**
         * Resolver answer when the element is present. Without one, falls back to the declared
         * type name and records a {@code MISSING_ELEMENT} warning.
         */
        private boolean producesWidget(Declaration d, String parent, String declaredType, boolean isClass) {
            Element element = d.element();
            if (element != null) return resolver.producesWidget(element);
            IrSourceLocation loc = locations.locate(d);
            warnings.warn(ExtractionWarnings.MISSING_ELEMENT, "No element for declaration", loc,
                    "declaration", qualifiedName(parent, d.name()));
            return declaredTypeIsWidget(declaredType, isClass);
        }

        private boolean declaredTypeIsWidget(String declaredType, boolean isClass) {
            String name = baseTypeName(declaredType);
            if (name.isEmpty()) return false;
            if (name.equals(WidgetConventions.ROOT_COMPONENT_TYPE) || registry.isKnownWidget(name)) return true;
            return isClass && name.equals(WidgetConventions.STATE_HOLDER_TYPE);
        }

        /** {@code Future<List<Widget>>?} becomes {@code Future}. */
        private static String baseTypeName(String type) {
            if (type == null) return "";
            String t = type.trim();
            int generic = t.indexOf('<');
            if (generic >= 0) t = t.substring(0, generic);
            if (t.endsWith("?")) t = t.substring(0, t.length() - 1);
            return t.trim();
        }

        private static String qualifiedName(String parent, String name) {
            return parent == null ? name : parent + "." + name;
        }
    }
}
