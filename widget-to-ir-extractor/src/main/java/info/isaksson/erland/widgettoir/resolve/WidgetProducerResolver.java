package info.isaksson.erland.widgettoir.resolve;

import info.isaksson.erland.widgettoir.element.AccessorElement;
import info.isaksson.erland.widgettoir.element.ClassElement;
import info.isaksson.erland.widgettoir.element.ConstructorElement;
import info.isaksson.erland.widgettoir.element.Element;
import info.isaksson.erland.widgettoir.element.ElementVisitor;
import info.isaksson.erland.widgettoir.element.ExecutableElement;
import info.isaksson.erland.widgettoir.element.FieldElement;
import info.isaksson.erland.widgettoir.element.FunctionElement;
import info.isaksson.erland.widgettoir.element.InterfaceTypeRef;
import info.isaksson.erland.widgettoir.element.MethodElement;
import info.isaksson.erland.widgettoir.element.ParameterElement;
import info.isaksson.erland.widgettoir.element.SpecialTypeRef;
import info.isaksson.erland.widgettoir.element.TypeParameterTypeRef;
import info.isaksson.erland.widgettoir.element.TypeRef;
import info.isaksson.erland.widgettoir.ir.WidgetConventions;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a declaration produces widgets.
 *
 * <p>Answers are memoized per instance. An element that is asked about again while its own
 * answer is still being computed (a redirect cycle, a class whose member refers back to it)
 * answers {@code false} for that nested question. Call {@link #resetCache()} between unrelated
 * runs.</p>
 *
 * <p>Not thread-safe; use one instance per file.</p>
 */
public final class WidgetProducerResolver {

    private final String frameworkLibraryUri;
    private final Map<Element, Boolean> memo = new HashMap<>();
    private final Set<Element> visiting = new HashSet<>();
    private final Rules rules = new Rules();

    public WidgetProducerResolver() {
        this(WidgetConventions.FRAMEWORK_LIBRARY);
    }

    /**
     * @param frameworkLibraryUri library that declares the root component, state holder and
     *                            build-context types
     */
    public WidgetProducerResolver(String frameworkLibraryUri) {
        this.frameworkLibraryUri = frameworkLibraryUri == null ? WidgetConventions.FRAMEWORK_LIBRARY : frameworkLibraryUri;
    }

    public boolean producesWidget(Element element) {
        if (element == null) return false;
        Boolean cached = memo.get(element);
        if (cached != null) return cached;
        if (!visiting.add(element)) return false;
        try {
            boolean result = element.accept(rules);
            memo.put(element, result);
            return result;
        } finally {
            visiting.remove(element);
        }
    }

    /**
     * True when {@code type} is the root component type or a subtype of it. Type parameters are
     * judged by their bound; {@code Never} is not a widget.
     */
    public boolean isWidgetType(TypeRef type) {
        if (type == null || type == SpecialTypeRef.NEVER) return false;
        if (type instanceof TypeParameterTypeRef tp) return isWidgetType(tp.bound());
        if (!(type instanceof InterfaceTypeRef it)) return false;
        if (isFrameworkClass(it.element(), WidgetConventions.ROOT_COMPONENT_TYPE)) return true;
        for (ClassElement s : it.element().allSupertypes()) {
            if (isFrameworkClass(s, WidgetConventions.ROOT_COMPONENT_TYPE)) return true;
        }
        return false;
    }

    /** {@code List<Widget>}, {@code Future<Text>}, {@code Map<String, List<Widget>>}... */
    public boolean isWidgetContainerType(TypeRef type) {
        if (!(type instanceof InterfaceTypeRef it)) return false;
        for (TypeRef arg : it.typeArguments()) {
            if (containsWidget(arg)) return true;
        }
        return false;
    }

    public void resetCache() {
        memo.clear();
        visiting.clear();
    }

    public int cacheSize() {
        return memo.size();
    }

    private boolean containsWidget(TypeRef type) {
        if (isWidgetType(type)) return true;
        if (type instanceof InterfaceTypeRef it) {
            for (TypeRef arg : it.typeArguments()) {
                if (containsWidget(arg)) return true;
            }
            return false;
        }
        if (type instanceof TypeParameterTypeRef tp) return tp.bound() != null && containsWidget(tp.bound());
        return false;
    }

    private boolean isFrameworkClass(ClassElement c, String name) {
        return c != null && name.equals(c.name) && Objects.equals(frameworkLibraryUri, c.libraryUri);
    }

    private boolean extendsStateHolder(ClassElement c) {
        for (ClassElement s : c.allSupertypes()) {
            if (isFrameworkClass(s, WidgetConventions.STATE_HOLDER_TYPE)) return true;
        }
        return false;
    }

    /** Name mentions build/render and one parameter is a build context. */
    private boolean looksLikeBuilder(ExecutableElement e) {
        String lower = e.name.toLowerCase(Locale.ROOT);
        boolean named = false;
        for (String marker : WidgetConventions.BUILDER_NAME_MARKERS) {
            if (lower.contains(marker)) {
                named = true;
                break;
            }
        }
        if (!named) return false;
        for (ParameterElement p : e.parameters) {
            if (isBuildContext(p.type)) return true;
        }
        return false;
    }

    private boolean isBuildContext(TypeRef type) {
        if (type == null) return false;
        if (type instanceof InterfaceTypeRef it && isFrameworkClass(it.element(), WidgetConventions.BUILD_CONTEXT_TYPE)) {
            return true;
        }
        return type.displayName().contains(WidgetConventions.BUILD_CONTEXT_TYPE);
    }

    private boolean executableProducesWidget(ExecutableElement e) {
        return isWidgetType(e.returnType) || isWidgetContainerType(e.returnType) || looksLikeBuilder(e);
    }

    private final class Rules implements ElementVisitor<Boolean> {

        @Override
        public Boolean visitClass(ClassElement c) {
            if (isWidgetType(c.thisType())) return true;
            if (extendsStateHolder(c)) {
                for (var m : c.methods) {
                    if (!m.isStatic && WidgetConventions.BUILD_METHOD.equals(m.name)) return true;
                }
                return false;
            }
            for (var m : c.methods) {
                if (producesWidget(m)) return true;
            }
            for (var ctor : c.constructors) {
                if (producesWidget(ctor)) return true;
            }
            for (var f : c.fields) {
                if (producesWidget(f)) return true;
            }
            return false;
        }

        @Override
        public Boolean visitMethod(MethodElement m) {
            return executableProducesWidget(m);
        }

        @Override
        public Boolean visitAccessor(AccessorElement a) {
            return executableProducesWidget(a);
        }

        @Override
        public Boolean visitFunction(FunctionElement f) {
            return executableProducesWidget(f);
        }

        @Override
        public Boolean visitConstructor(ConstructorElement ctor) {
            if (ctor.isConst && ctor.enclosingClass != null && isWidgetType(ctor.enclosingClass.thisType())) return true;
            if (ctor.isFactory && ctor.redirectedConstructor != null) return producesWidget(ctor.redirectedConstructor);
            return isWidgetType(ctor.returnType);
        }

        @Override
        public Boolean visitField(FieldElement f) {
            if (f.getter != null && producesWidget(f.getter)) return true;
            return isWidgetType(f.type);
        }

        @Override
        public Boolean visitParameter(ParameterElement p) {
            return false;
        }
    }
}
