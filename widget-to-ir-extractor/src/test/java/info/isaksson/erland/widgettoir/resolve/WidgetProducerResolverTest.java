package info.isaksson.erland.widgettoir.resolve;

import info.isaksson.erland.widgettoir.element.ClassElement;
import info.isaksson.erland.widgettoir.element.ConstructorElement;
import info.isaksson.erland.widgettoir.element.FieldElement;
import info.isaksson.erland.widgettoir.element.FunctionElement;
import info.isaksson.erland.widgettoir.element.InterfaceTypeRef;
import info.isaksson.erland.widgettoir.element.MethodElement;
import info.isaksson.erland.widgettoir.element.SpecialTypeRef;
import info.isaksson.erland.widgettoir.element.TypeParameterTypeRef;
import info.isaksson.erland.widgettoir.ir.WidgetConventions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WidgetProducerResolverTest {

    private static final String FW = WidgetConventions.FRAMEWORK_LIBRARY;
    private static final String APP = "package:app/main.dart";

    private final ClassElement widget = new ClassElement("Widget", FW);
    private final ClassElement state = new ClassElement("State", FW);
    private final ClassElement buildContext = new ClassElement("BuildContext", FW);

    private ClassElement subclassOf(String name, ClassElement parent) {
        ClassElement c = new ClassElement(name, APP);
        c.supertype = InterfaceTypeRef.of(parent);
        return c;
    }

    @Test
    public void inheritanceChainsOfAnyLengthResolve() {
        for (int length : new int[]{1, 5, 20}) {
            WidgetProducerResolver resolver = new WidgetProducerResolver();
            ClassElement current = widget;
            for (int i = 0; i < length; i++) {
                current = subclassOf("W" + length + "_" + i, current);
            }
            assertTrue(resolver.producesWidget(current), "chain of " + length);
            assertTrue(resolver.isWidgetType(current.thisType()));
        }
    }

    @Test
    public void unrelatedClassDoesNotProduceWidget() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement model = new ClassElement("Model", APP);
        model.addMethod("save", SpecialTypeRef.VOID);
        assertFalse(resolver.producesWidget(model));
        assertFalse(resolver.producesWidget(null));
    }

    @Test
    public void widgetNamedClassFromOtherLibraryIsNotTheRoot() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement impostor = new ClassElement("Widget", APP);
        assertFalse(resolver.producesWidget(subclassOf("Fake", impostor)));
    }

    @Test
    public void redirectCycleTerminatesWithFalse() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement a = new ClassElement("A", APP);
        ClassElement b = new ClassElement("B", APP);
        ConstructorElement ca = a.addConstructor("");
        ConstructorElement cb = b.addConstructor("");
        ca.isFactory = true;
        cb.isFactory = true;
        ca.redirectedConstructor = cb;
        cb.redirectedConstructor = ca;

        assertFalse(resolver.producesWidget(ca));
        assertFalse(resolver.producesWidget(cb));
    }

    @Test
    public void factoryRedirectingToWidgetConstructorProducesWidget() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement button = subclassOf("Button", widget);
        ClassElement factoryHost = new ClassElement("Buttons", APP);
        ConstructorElement target = button.addConstructor("");
        ConstructorElement factory = factoryHost.addConstructor("primary");
        factory.isFactory = true;
        factory.redirectedConstructor = target;

        assertTrue(resolver.producesWidget(factory));
    }

    @Test
    public void stateSubclassWithBuildMethodProducesWidget() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement counterState = subclassOf("_CounterState", state);
        assertFalse(resolver.producesWidget(counterState));

        resolver.resetCache();
        counterState.addMethod("build", InterfaceTypeRef.of(widget));
        assertTrue(resolver.producesWidget(counterState));
    }

    @Test
    public void staticBuildMethodOnStateDoesNotCount() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement counterState = subclassOf("_CounterState", state);
        counterState.addMethod("build", InterfaceTypeRef.of(widget)).isStatic = true;
        assertFalse(resolver.producesWidget(counterState));
    }

    @Test
    public void containerReturnTypesProduceWidgets() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement list = new ClassElement("List", "dart:core");
        ClassElement future = new ClassElement("Future", "dart:async");
        ClassElement text = subclassOf("Text", widget);

        FunctionElement items = new FunctionElement("items", APP);
        items.returnType = InterfaceTypeRef.of(list, InterfaceTypeRef.of(widget));
        FunctionElement later = new FunctionElement("later", APP);
        later.returnType = InterfaceTypeRef.of(future, InterfaceTypeRef.of(list, InterfaceTypeRef.of(text)));
        FunctionElement numbers = new FunctionElement("numbers", APP);
        numbers.returnType = InterfaceTypeRef.of(list, InterfaceTypeRef.of(new ClassElement("int", "dart:core")));

        assertTrue(resolver.producesWidget(items));
        assertTrue(resolver.producesWidget(later));
        assertFalse(resolver.producesWidget(numbers));
    }

    @Test
    public void builderHeuristicNeedsNameAndBuildContextParameter() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        FunctionElement renderRow = new FunctionElement("renderRow", APP);
        renderRow.returnType = SpecialTypeRef.DYNAMIC;
        renderRow.addParameter("context", InterfaceTypeRef.of(buildContext));

        FunctionElement helper = new FunctionElement("helper", APP);
        helper.returnType = SpecialTypeRef.DYNAMIC;
        helper.addParameter("context", InterfaceTypeRef.of(buildContext));

        FunctionElement buildLabel = new FunctionElement("buildLabel", APP);
        buildLabel.returnType = SpecialTypeRef.DYNAMIC;
        buildLabel.addParameter("index", InterfaceTypeRef.of(new ClassElement("int", "dart:core")));

        assertTrue(resolver.producesWidget(renderRow));
        assertFalse(resolver.producesWidget(helper));
        assertFalse(resolver.producesWidget(buildLabel));
    }

    @Test
    public void neverIsNotAWidget() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        FunctionElement fail = new FunctionElement("fail", APP);
        fail.returnType = SpecialTypeRef.NEVER;
        assertFalse(resolver.producesWidget(fail));
        assertFalse(resolver.isWidgetType(SpecialTypeRef.NEVER));
    }

    @Test
    public void typeParameterIsJudgedByItsBound() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        assertTrue(resolver.isWidgetType(new TypeParameterTypeRef("T", InterfaceTypeRef.of(widget))));
        assertFalse(resolver.isWidgetType(new TypeParameterTypeRef("T", null)));
    }

    @Test
    public void classWithWidgetGetterFieldProducesWidget() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement holder = new ClassElement("Holder", APP);
        FieldElement header = holder.addField("header", InterfaceTypeRef.of(widget));
        assertTrue(resolver.producesWidget(header));
        assertTrue(resolver.producesWidget(holder));
    }

    @Test
    public void selfReferencingClassMemberTerminates() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement node = new ClassElement("Node", APP);
        MethodElement next = node.addMethod("next", InterfaceTypeRef.of(node));
        assertFalse(resolver.producesWidget(node));
        assertFalse(resolver.producesWidget(next));
    }

    @Test
    public void answersAreMemoizedUntilReset() {
        WidgetProducerResolver resolver = new WidgetProducerResolver();
        ClassElement card = subclassOf("Card", widget);
        resolver.producesWidget(card);
        assertEquals(1, resolver.cacheSize());
        resolver.resetCache();
        assertEquals(0, resolver.cacheSize());
    }

    @Test
    public void customFrameworkLibraryIsHonoured() {
        ClassElement otherRoot = new ClassElement("Widget", "package:ui/core.dart");
        ClassElement tile = subclassOf("Tile", otherRoot);
        assertFalse(new WidgetProducerResolver().producesWidget(tile));
        assertTrue(new WidgetProducerResolver("package:ui/core.dart").producesWidget(tile));
    }
}
