package info.isaksson.erland.widgettoir.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.widgettoir.syntax.Syntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class SyntaxPrinterTest {

    @Test
    public void printsConstructorCallsWithNamedArguments() {
        Expression e = createConst("Text", string("Hello"), named("style", property(id("theme"), "title")));
        assertEquals("const Text(\"Hello\", style: theme.title)", SyntaxPrinter.print(e));
        assertEquals("Padding.only(left: 8)", SyntaxPrinter.print(createNamed("Padding", "only", named("left", integer(8)))));
    }

    @Test
    public void printsCollectionsAndElements() {
        Expression e = list(id("a"), spread(id("rest")), nullAwareSpread(id("maybe")),
                ifElement(id("show"), id("b"), id("c")), forIn("x", id("xs"), id("x")));
        assertEquals("[a, ...rest, ...?maybe, if (show) b else c, for (final x in xs) x]", SyntaxPrinter.print(e));
        assertEquals("{\"k\": 1}", SyntaxPrinter.print(map(entry(string("k"), integer(1)))));
    }

    @Test
    public void printsClosuresAndCascades() {
        FormalParameterList ps = paramList(param("context"),
                new FormalParameter(Span.NONE, "index", "int", FormalParameter.Kind.NAMED, true, null));
        assertEquals("(context, {required int index}) => Item(index)",
                SyntaxPrinter.print(arrow(ps, create("Item", id("index")))));
        assertEquals("() async { await load(); }",
                SyntaxPrinter.print(asyncClosure(params(),
                        stmt(new AwaitExpression(Span.NONE, call("load"))))));
        assertEquals("Paint()..color = red..stroke()",
                SyntaxPrinter.print(cascade(create("Paint"),
                        assign(new PropertyAccess(Span.NONE, null, "..", "color"), "=", id("red")),
                        cascadeCall("stroke"))));
    }

    @Test
    public void printsStatements() {
        Statement s = ifStatement(binary(id("n"), ">", integer(0)), block(ret(id("n"))), ret(null));
        assertEquals("if (n > 0) { return n; } else return;", SyntaxPrinter.print(s));
        assertEquals("{}", SyntaxPrinter.print(block()));
        assertEquals("final a = 1;", SyntaxPrinter.print(declare("a", integer(1))));
        assertEquals("try {} on E catch (e) {} finally {}", SyntaxPrinter.print(new TryStatement(Span.NONE, block(),
                List.of(new CatchClause(Span.NONE, "E", "e", null, block())), block())));
    }

    @Test
    public void opaqueNodesPrintTheirSourceAndNullPrintsEmpty() {
        assertEquals("(1, 2)", SyntaxPrinter.print(opaque("RecordLiteral", "(1, 2)")));
        assertEquals("", SyntaxPrinter.print(null));
        assertEquals("a.", SyntaxPrinter.print(new PrefixedIdentifier(Span.NONE, id("a"), null)));
    }

    @Test
    public void printingIsStable() {
        Expression e = call(id("list"), "map", arrow(params("x"), binary(id("x"), "*", integer(2))));
        assertEquals(SyntaxPrinter.print(e), SyntaxPrinter.print(e));
        assertEquals("list.map((x) => x * 2)", SyntaxPrinter.print(e));
    }
}
