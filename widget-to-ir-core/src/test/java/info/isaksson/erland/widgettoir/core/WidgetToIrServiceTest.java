package info.isaksson.erland.widgettoir.core;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.widgettoir.component.Component;
import info.isaksson.erland.widgettoir.component.ComponentTrees;
import info.isaksson.erland.widgettoir.component.WidgetComponent;
import info.isaksson.erland.widgettoir.element.ClassElement;
import info.isaksson.erland.widgettoir.element.ConstructorElement;
import info.isaksson.erland.widgettoir.element.FieldElement;
import info.isaksson.erland.widgettoir.element.FunctionElement;
import info.isaksson.erland.widgettoir.element.InterfaceTypeRef;
import info.isaksson.erland.widgettoir.element.MethodElement;
import info.isaksson.erland.widgettoir.element.SpecialTypeRef;
import info.isaksson.erland.widgettoir.extract.ComponentExtractor;
import info.isaksson.erland.widgettoir.ir.IrJson;
import info.isaksson.erland.widgettoir.ir.WidgetConventions;
import info.isaksson.erland.widgettoir.ir.stmt.IrExpressionKind;
import info.isaksson.erland.widgettoir.ir.stmt.IrExpressionStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrUnknownStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrVariableDeclarationStatement;
import info.isaksson.erland.widgettoir.syntax.ClassDeclaration;
import info.isaksson.erland.widgettoir.syntax.CompilationUnit;
import info.isaksson.erland.widgettoir.syntax.ConstructorDeclaration;
import info.isaksson.erland.widgettoir.syntax.FieldDeclaration;
import info.isaksson.erland.widgettoir.syntax.FieldInitializer;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclaration;
import info.isaksson.erland.widgettoir.syntax.MethodDeclaration;
import info.isaksson.erland.widgettoir.syntax.OpaqueStatement;
import info.isaksson.erland.widgettoir.syntax.Span;
import info.isaksson.erland.widgettoir.syntax.TopLevelVariableDeclaration;
import info.isaksson.erland.widgettoir.syntax.VariableDeclaration;
import info.isaksson.erland.widgettoir.syntax.VariableDeclarationList;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static info.isaksson.erland.widgettoir.syntax.Syntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class WidgetToIrServiceTest {

    private static final String FW = WidgetConventions.FRAMEWORK_LIBRARY;
    private static final String APP = "package:app/greeting.dart";

    /**
     * <pre>
     * class Greeting extends StatelessWidget {
     *   final String name;
     *   Greeting(String n) : name = n;
     *   Widget build(BuildContext context) {
     *     if (name.isEmpty) return Text("?");
     *     return Column(children: [Text("Hi"), Text(name)]);
     *   }
     *   void log() { print(name); var (a, b) = pair; }
     * }
     * Widget header = Text("Header");
     * MyCard card = MyCard();
     * void main() { runApp(Greeting("x")); }
     * </pre>
     * The two top-level variables carry no element.
     */
    private static FileInput sample() {
        ClassElement widget = new ClassElement("Widget", FW);
        ClassElement stateless = new ClassElement("StatelessWidget", FW);
        stateless.supertype = InterfaceTypeRef.of(widget);
        ClassElement buildContext = new ClassElement("BuildContext", FW);
        ClassElement string = new ClassElement("String", "dart:core");

        ClassElement greeting = new ClassElement("Greeting", APP);
        greeting.supertype = InterfaceTypeRef.of(stateless);
        FieldElement nameField = greeting.addField("name", InterfaceTypeRef.of(string));
        ConstructorElement ctor = greeting.addConstructor("");
        MethodElement build = greeting.addMethod("build", InterfaceTypeRef.of(widget));
        build.addParameter("context", InterfaceTypeRef.of(buildContext));
        MethodElement log = greeting.addMethod("log", SpecialTypeRef.VOID);
        FunctionElement main = new FunctionElement("main", APP);
        main.returnType = SpecialTypeRef.VOID;

        FieldDeclaration field = new FieldDeclaration(Span.NONE, false, new VariableDeclarationList(Span.NONE, "final", false,
                "String", List.of(new VariableDeclaration(Span.NONE, "name", null))), nameField);
        ConstructorDeclaration constructor = new ConstructorDeclaration(Span.NONE, "Greeting", null,
                paramList(param("n", "String")), List.of(new FieldInitializer(Span.NONE, "name", id("n"))),
                null, false, false, null, ctor);
        MethodDeclaration buildDecl = new MethodDeclaration(Span.NONE, "build", "Widget", null,
                paramList(param("context", "BuildContext")),
                blockBody(
                        ifStatement(property(id("name"), "isEmpty"), ret(create("Text", string("?"))), null),
                        ret(create("Column", named("children", list(create("Text", string("Hi")), create("Text", id("name"))))))),
                false, build);
        MethodDeclaration logDecl = new MethodDeclaration(Span.NONE, "log", "void", null, params(),
                blockBody(stmt(call("print", id("name"))),
                        new OpaqueStatement(Span.NONE, "PatternVariableDeclarationStatement", "var (a, b) = pair;")),
                false, log);
        ClassDeclaration greetingDecl = new ClassDeclaration(Span.NONE, "Greeting", "StatelessWidget",
                List.of(field, constructor, buildDecl, logDecl), greeting);

        TopLevelVariableDeclaration header = new TopLevelVariableDeclaration(Span.NONE,
                new VariableDeclarationList(Span.NONE, null, false, "Widget",
                        List.of(new VariableDeclaration(Span.NONE, "header", create("Text", string("Header"))))), null);
        TopLevelVariableDeclaration card = new TopLevelVariableDeclaration(Span.NONE,
                new VariableDeclarationList(Span.NONE, null, false, "MyCard",
                        List.of(new VariableDeclaration(Span.NONE, "card", create("MyCard")))), null);
        FunctionDeclaration mainDecl = new FunctionDeclaration(Span.NONE, "main", "void", null,
                closure(params(), stmt(call("runApp", create("Greeting", string("x"))))), main);

        CompilationUnit unit = new CompilationUnit(Span.NONE, List.of(greetingDecl, header, card, mainDecl));
        return new FileInput("lib/greeting.dart", "", unit);
    }

    @Test
    public void rejectsNullInput() {
        assertThrows(IllegalArgumentException.class, () -> new WidgetToIrService().extractFile(null, new WidgetToIrOptions()));
        assertThrows(IllegalArgumentException.class, () -> new FileInput("a.dart", "", null));
    }

    @Test
    public void recordsEveryDeclarationInSourceOrder() {
        WidgetToIrResult result = new WidgetToIrService().extractFile(sample(), null);

        List<String> names = result.declarations.stream().map(d -> d.qualifiedName).collect(Collectors.toList());
        assertEquals(List.of("Greeting", "Greeting.name", "Greeting.Greeting", "Greeting.build", "Greeting.log",
                "header", "card", "main"), names);
        assertEquals("lib/greeting.dart", result.file);

        DeclarationRecord cls = result.declaration("Greeting");
        assertEquals(DeclarationKind.CLASS, cls.kind);
        assertTrue(cls.producesWidget);
        assertTrue(cls.resolved);

        DeclarationRecord field = result.declaration("Greeting.name");
        assertEquals(DeclarationKind.FIELD, field.kind);
        assertFalse(field.producesWidget);
        assertInstanceOf(IrVariableDeclarationStatement.class, field.body.get(0));

        DeclarationRecord ctor = result.declaration("Greeting.Greeting");
        assertEquals(DeclarationKind.CONSTRUCTOR, ctor.kind);
        assertTrue(ctor.producesWidget);
        assertEquals(1, ctor.initializers.size());
        assertTrue(ctor.components.isEmpty());

        DeclarationRecord main = result.declaration("main");
        assertEquals(DeclarationKind.FUNCTION, main.kind);
        assertFalse(main.producesWidget);
        assertEquals(IrExpressionKind.FRAMEWORK_INITIALIZATION,
                assertInstanceOf(IrExpressionStatement.class, main.body.get(0)).classification);
    }

    @Test
    public void widgetProducingMethodsGetOneTreePerReturn() {
        WidgetToIrResult result = new WidgetToIrService().extractFile(sample(), new WidgetToIrOptions());

        DeclarationRecord build = result.declaration("Greeting.build");
        assertEquals(DeclarationKind.METHOD, build.kind);
        assertTrue(build.producesWidget);
        assertEquals(2, build.components.size());
        assertEquals("Text", ((WidgetComponent) build.components.get(0)).widgetName);
        WidgetComponent column = (WidgetComponent) build.components.get(1);
        assertEquals("Column", column.widgetName);
        assertEquals(2, column.children.size());
        assertEquals(2, build.body.size());

        DeclarationRecord log = result.declaration("Greeting.log");
        assertFalse(log.producesWidget);
        assertTrue(log.components.isEmpty());

        assertEquals(3, result.components().size(), "two trees from build, one from header");
        assertEquals(5, result.extractorStatistics.get(ComponentExtractor.STAT_WIDGETS));
    }

    @Test
    public void unresolvedDeclarationsFallBackToDeclaredTypes() {
        WidgetToIrResult result = new WidgetToIrService().extractFile(sample(), null);

        DeclarationRecord header = result.declaration("header");
        assertEquals(DeclarationKind.TOP_LEVEL_VARIABLE, header.kind);
        assertFalse(header.resolved);
        assertTrue(header.producesWidget);
        assertEquals(1, header.components.size());

        DeclarationRecord card = result.declaration("card");
        assertFalse(card.producesWidget, "MyCard is not a known widget by default");
        assertTrue(card.components.isEmpty());

        List<ExtractionWarning> missing = result.warnings(ExtractionWarnings.MISSING_ELEMENT);
        assertEquals(2, missing.size());
        assertEquals("card", missing.get(0).context.get("declaration"));
        assertEquals("header", missing.get(1).context.get("declaration"));

        WidgetToIrOptions options = new WidgetToIrOptions();
        options.additionalKnownWidgets = List.of("MyCard");
        DeclarationRecord known = new WidgetToIrService().extractFile(sample(), options).declaration("card");
        assertTrue(known.producesWidget);
        assertEquals(1, known.components.size());
    }

    @Test
    public void unknownStatementsBecomeWarnings() {
        WidgetToIrResult result = new WidgetToIrService().extractFile(sample(), null);

        DeclarationRecord log = result.declaration("Greeting.log");
        IrUnknownStatement unknown = assertInstanceOf(IrUnknownStatement.class, log.body.get(1));

        List<ExtractionWarning> warnings = result.warnings(ExtractionWarnings.UNKNOWN_STATEMENT);
        assertEquals(1, warnings.size());
        assertEquals("Unsupported statement: PatternVariableDeclarationStatement", warnings.get(0).message);
        assertEquals(unknown.id, warnings.get(0).context.get("node"));
        assertTrue(result.warnings(ExtractionWarnings.UNKNOWN_EXPRESSION).isEmpty());
    }

    @Test
    public void optionsToggleBodiesAndComponents() {
        WidgetToIrOptions noBodies = new WidgetToIrOptions();
        noBodies.includeBodies = false;
        WidgetToIrResult a = new WidgetToIrService().extractFile(sample(), noBodies);
        assertTrue(a.declaration("Greeting.build").body.isEmpty());
        assertTrue(a.declaration("Greeting.Greeting").initializers.isEmpty());
        assertEquals(2, a.declaration("Greeting.build").components.size());
        assertTrue(a.warnings(ExtractionWarnings.UNKNOWN_STATEMENT).isEmpty());

        WidgetToIrOptions noComponents = new WidgetToIrOptions();
        noComponents.extractComponents = false;
        WidgetToIrResult b = new WidgetToIrService().extractFile(sample(), noComponents);
        assertTrue(b.components().isEmpty());
        assertTrue(b.declaration("Greeting.build").producesWidget);
        assertEquals(2, b.declaration("Greeting.build").body.size());
    }

    @Test
    public void shallowRecursionLimitReportsFallbacks() {
        WidgetToIrOptions options = new WidgetToIrOptions();
        options.maxRecursionDepth = 1;
        WidgetToIrResult result = new WidgetToIrService().extractFile(sample(), options);

        List<ExtractionWarning> fallbacks = result.warnings(ExtractionWarnings.COMPONENT_FALLBACK);
        assertEquals(2, fallbacks.size());
        for (ExtractionWarning w : fallbacks) {
            assertEquals("Greeting.build", w.context.get("declaration"));
            assertTrue(w.context.get("component").startsWith("fallback_"));
        }
    }

    @Test
    public void jsonOutputIsDeterministic() throws Exception {
        String first = new WidgetToIrService().extractFile(sample(), null).toJson();
        String second = new WidgetToIrService().extractFile(sample(), null).toJson();
        assertEquals(first, second);
        assertTrue(first.endsWith("\n"));

        JsonNode tree = IrJson.readTree(first);
        assertEquals("lib/greeting.dart", tree.get("file").asText());
        assertEquals(8, tree.get("declarations").size());
        JsonNode build = tree.get("declarations").get(3);
        assertEquals("method", build.get("kind").asText());
        assertEquals("widget", build.get("components").get(1).get("type").asText());
        assertEquals("Greeting", build.get("parent").asText());
        assertFalse(tree.get("declarations").get(5).has("parent"), "top-level declarations have no parent");

        Path out = Files.createTempDirectory("widget-to-ir-").resolve("greeting.json");
        new WidgetToIrService().extractFile(sample(), null).writeJson(out);
        assertEquals(first, Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    public void everyComponentIdIsUniqueWithinAFile() {
        WidgetToIrResult result = new WidgetToIrService().extractFile(sample(), null);
        Set<String> ids = new HashSet<>();
        for (Component root : result.components()) {
            for (Component c : ComponentTrees.flatten(root)) {
                assertTrue(ids.add(c.id), "duplicate id " + c.id);
            }
        }
    }
}
