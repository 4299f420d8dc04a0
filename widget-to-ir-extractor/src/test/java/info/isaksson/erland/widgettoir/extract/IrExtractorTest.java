package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.ir.expr.IrAssignmentExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrBinaryExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrBinaryOperator;
import info.isaksson.erland.widgettoir.ir.expr.IrCompoundAssignmentExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrConditionalExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrIdentifierExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrLambdaExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrListLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrLiteralKind;
import info.isaksson.erland.widgettoir.ir.expr.IrMapLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrMethodCallExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrNullCoalescingExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrParameterKind;
import info.isaksson.erland.widgettoir.ir.expr.IrPatternMatchExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrPropertyAccessExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSkippedElementExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrStringInterpolationExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSuperExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrThisExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrUnaryExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrUnaryOperator;
import info.isaksson.erland.widgettoir.ir.expr.IrUnknownExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrVariablePattern;
import info.isaksson.erland.widgettoir.ir.stmt.IrAssertStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrExpressionKind;
import info.isaksson.erland.widgettoir.ir.stmt.IrExpressionStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrForEachStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrIfStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrReturnStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrSwitchStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrThrowStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrTryStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrUnknownStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrVariableDeclarationStatement;
import info.isaksson.erland.widgettoir.source.LocationMapper;
import info.isaksson.erland.widgettoir.syntax.AssertInitializer;
import info.isaksson.erland.widgettoir.syntax.BreakStatement;
import info.isaksson.erland.widgettoir.syntax.CaseClause;
import info.isaksson.erland.widgettoir.syntax.CatchClause;
import info.isaksson.erland.widgettoir.syntax.ConstructorDeclaration;
import info.isaksson.erland.widgettoir.syntax.DeclaredVariablePattern;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.FieldInitializer;
import info.isaksson.erland.widgettoir.syntax.FormalParameter;
import info.isaksson.erland.widgettoir.syntax.GuardedPattern;
import info.isaksson.erland.widgettoir.syntax.IfStatement;
import info.isaksson.erland.widgettoir.syntax.OpaqueStatement;
import info.isaksson.erland.widgettoir.syntax.PrefixedIdentifier;
import info.isaksson.erland.widgettoir.syntax.RethrowExpression;
import info.isaksson.erland.widgettoir.syntax.Span;
import info.isaksson.erland.widgettoir.syntax.SuperConstructorInvocation;
import info.isaksson.erland.widgettoir.syntax.SwitchCase;
import info.isaksson.erland.widgettoir.syntax.SwitchDefault;
import info.isaksson.erland.widgettoir.syntax.SwitchStatement;
import info.isaksson.erland.widgettoir.syntax.ThrowExpression;
import info.isaksson.erland.widgettoir.syntax.TryStatement;
import info.isaksson.erland.widgettoir.syntax.VariableDeclaration;
import info.isaksson.erland.widgettoir.syntax.VariableDeclarationList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.widgettoir.syntax.Syntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class IrExtractorTest {

    private static IrExtractor newExtractor() {
        return new IrExtractor(new LocationMapper("lib/main.dart", ""), new IrIdGenerator("lib/main.dart"));
    }

    @Test
    public void literalsKeepTheirValues() {
        IrExtractor ir = newExtractor();
        IrLiteralExpression i = assertInstanceOf(IrLiteralExpression.class, ir.extractExpression(integer(42)));
        assertEquals(42L, i.value);
        assertEquals(IrLiteralKind.INTEGER, i.literalKind);
        assertEquals(2.5, assertInstanceOf(IrLiteralExpression.class, ir.extractExpression(decimal(2.5))).value);
        assertEquals(Boolean.TRUE, assertInstanceOf(IrLiteralExpression.class, ir.extractExpression(bool(true))).value);
        assertEquals("hi", assertInstanceOf(IrLiteralExpression.class, ir.extractExpression(string("hi"))).value);
        IrLiteralExpression nul = assertInstanceOf(IrLiteralExpression.class, ir.extractExpression(nullLiteral()));
        assertNull(nul.value);
        assertEquals(IrLiteralKind.NULL, nul.literalKind);
    }

    @Test
    public void everyOperatorMapsToItsIrForm() {
        IrExtractor ir = newExtractor();
        IrBinaryExpression plus = assertInstanceOf(IrBinaryExpression.class,
                ir.extractExpression(binary(id("a"), "+", integer(1))));
        assertEquals(IrBinaryOperator.ADD, plus.operator);
        assertEquals("a", assertInstanceOf(IrIdentifierExpression.class, plus.left).name);

        assertInstanceOf(IrNullCoalescingExpression.class, ir.extractExpression(binary(id("a"), "??", id("b"))));

        IrUnaryExpression not = assertInstanceOf(IrUnaryExpression.class, ir.extractExpression(prefix("!", id("ok"))));
        assertEquals(IrUnaryOperator.NOT, not.operator);
        assertTrue(not.prefix);

        IrUnaryExpression inc = assertInstanceOf(IrUnaryExpression.class, ir.extractExpression(postfix(id("i"), "++")));
        assertEquals(IrUnaryOperator.INCREMENT, inc.operator);
        assertFalse(inc.prefix);

        IrExpression asserted = ir.extractExpression(postfix(id("maybe"), "!"));
        assertInstanceOf(IrIdentifierExpression.class, asserted);
        assertEquals(Boolean.TRUE, asserted.metadataValue("nullAssert"));

        IrCompoundAssignmentExpression addAssign = assertInstanceOf(IrCompoundAssignmentExpression.class,
                ir.extractExpression(assign(id("x"), "+=", integer(2))));
        assertEquals(IrBinaryOperator.ADD, addAssign.operator);

        IrUnknownExpression odd = assertInstanceOf(IrUnknownExpression.class,
                ir.extractExpression(binary(id("a"), "<=>", id("b"))));
        assertEquals("Unsupported binary operator: <=>", odd.reason);
    }

    @Test
    public void interpolationKeepsPartOrderAndDropsEmptyText() {
        IrStringInterpolationExpression s = assertInstanceOf(IrStringInterpolationExpression.class,
                newExtractor().extractExpression(interpolation(text(""), embed(id("name")), text(" has "),
                        embed(binary(id("n"), "+", integer(1))), text(""))));
        assertEquals(3, s.parts.size());
        assertNull(s.parts.get(0).text);
        assertEquals("name", assertInstanceOf(IrIdentifierExpression.class, s.parts.get(0).expression).name);
        assertEquals(" has ", s.parts.get(1).text);
        assertInstanceOf(IrBinaryExpression.class, s.parts.get(2).expression);
    }

    @Test
    public void collectionElements() {
        IrListLiteralExpression l = assertInstanceOf(IrListLiteralExpression.class, newExtractor().extractExpression(
                list(integer(1), spread(id("more")), nullAwareSpread(id("maybe")),
                        ifElement(id("flag"), integer(2)), forIn("x", id("xs"), id("x")))));
        assertEquals(5, l.elements.size());
        assertInstanceOf(IrLiteralExpression.class, l.elements.get(0));
        assertEquals(Boolean.TRUE, l.elements.get(1).metadataValue("isSpread"));
        assertNull(l.elements.get(1).metadataValue("nullAwareSpread"));
        assertEquals(Boolean.TRUE, l.elements.get(2).metadataValue("nullAwareSpread"));

        IrConditionalExpression ifElem = assertInstanceOf(IrConditionalExpression.class, l.elements.get(3));
        assertEquals(Boolean.TRUE, ifElem.metadataValue("fromCollectionIf"));
        assertEquals(Boolean.FALSE, ifElem.metadataValue("thenIsSpread"));
        assertEquals(1, assertInstanceOf(IrListLiteralExpression.class, ifElem.thenExpression).elements.size());
        assertTrue(assertInstanceOf(IrListLiteralExpression.class, ifElem.elseExpression).elements.isEmpty());

        IrSkippedElementExpression skipped = assertInstanceOf(IrSkippedElementExpression.class, l.elements.get(4));
        assertEquals("Collection for elements are not supported", skipped.reason);
    }

    @Test
    public void mapLiteralSplitsEntries() {
        IrMapLiteralExpression m = assertInstanceOf(IrMapLiteralExpression.class, newExtractor().extractExpression(
                map(entry(string("a"), integer(1)), entry(string("b"), integer(2)))));
        assertEquals(2, m.entries.size());
        assertTrue(m.otherElements.isEmpty());
    }

    @Test
    public void lambdaMetadataAndReturnInference() {
        IrExtractor ir = newExtractor();
        FormalParameter named = new FormalParameter(Span.NONE, "label", "String", FormalParameter.Kind.NAMED, true, null);
        FormalParameter defaulted = new FormalParameter(Span.NONE, "size", "int", FormalParameter.Kind.NAMED, false, integer(1));

        IrLambdaExpression arrowString = ir.extractFunction(arrow(paramList(param("x"), named, defaulted), string("s")));
        assertTrue(arrowString.isArrow);
        assertEquals("String", arrowString.inferredReturnType);
        assertEquals(IrParameterKind.POSITIONAL, arrowString.parameters.get(0).kind);
        assertEquals(IrParameterKind.REQUIRED_NAMED, arrowString.parameters.get(1).kind);
        assertEquals(IrParameterKind.NAMED, arrowString.parameters.get(2).kind);
        assertEquals(List.of("positional", "required_named", "defaulted"), arrowString.metadataValue("parameterOrigins"));
        assertEquals(1, arrowString.body.size());

        assertEquals("dynamic", ir.extractFunction(arrow(params(), id("x"))).inferredReturnType);

        IrLambdaExpression nestedReturn = ir.extractFunction(closure(params(),
                ifStatement(id("c"), block(ret(integer(1))), null)));
        assertEquals("dynamic", nestedReturn.inferredReturnType);
        assertEquals(1, nestedReturn.metadataValue("statementCount"));

        IrLambdaExpression voidBody = ir.extractFunction(asyncClosure(params(), stmt(call("print", string("x"))), ret(null)));
        assertEquals(IrLambdaExpression.UNTYPED, voidBody.inferredReturnType);
        assertTrue(voidBody.isAsync);
    }

    @Test
    public void ifCaseBecomesPatternMatch() {
        CaseClause caseClause = new CaseClause(Span.NONE, new GuardedPattern(Span.NONE,
                new DeclaredVariablePattern(Span.NONE, "final", "int", "n"), binary(id("n"), ">", integer(0))));
        IfStatement s = new IfStatement(Span.NONE, id("value"), caseClause, block(), null);

        IrIfStatement out = assertInstanceOf(IrIfStatement.class, newExtractor().extractStatement(s));
        IrPatternMatchExpression match = assertInstanceOf(IrPatternMatchExpression.class, out.condition);
        assertEquals("value", assertInstanceOf(IrIdentifierExpression.class, match.subject).name);
        IrVariablePattern pattern = assertInstanceOf(IrVariablePattern.class, match.pattern);
        assertEquals("n", pattern.name);
        assertTrue(pattern.isFinal);
        assertInstanceOf(IrBinaryExpression.class, match.guard);
        assertNull(out.elseStatement);
    }

    @Test
    public void bodiesOfEveryShape() {
        IrExtractor ir = newExtractor();
        List<IrStatement> arrowBody = ir.extractBodyStatements(arrowBody(integer(1)));
        IrReturnStatement r = assertInstanceOf(IrReturnStatement.class, arrowBody.get(0));
        assertEquals(Boolean.TRUE, r.metadataValue("fromArrow"));

        assertEquals(3, ir.extractBodyStatements(blockBody(declare("a", integer(1)),
                forInStatement("x", id("xs"), block()), whileStatement(bool(true), new BreakStatement(Span.NONE, null)))).size());
        assertTrue(ir.extractBodyStatements(null).isEmpty());
    }

    @Test
    public void statementsMapToTheirIrForms() {
        IrExtractor ir = newExtractor();
        IrVariableDeclarationStatement decl = assertInstanceOf(IrVariableDeclarationStatement.class,
                ir.extractStatement(declare("count", integer(0))));
        assertTrue(decl.isFinal);
        assertEquals("count", decl.variables.get(0).name);

        IrForEachStatement each = assertInstanceOf(IrForEachStatement.class,
                ir.extractStatement(forInStatement("item", id("items"), block())));
        assertEquals("item", each.variableName);

        IrThrowStatement thrown = assertInstanceOf(IrThrowStatement.class,
                ir.extractStatement(stmt(new ThrowExpression(Span.NONE, create("StateError", string("bad"))))));
        assertFalse(thrown.rethrow);
        IrThrowStatement rethrown = assertInstanceOf(IrThrowStatement.class,
                ir.extractStatement(stmt(new RethrowExpression(Span.NONE))));
        assertTrue(rethrown.rethrow);

        TryStatement tryStatement = new TryStatement(Span.NONE, block(stmt(call("risky"))),
                List.of(new CatchClause(Span.NONE, "FormatException", "e", null, block())), block());
        IrTryStatement t = assertInstanceOf(IrTryStatement.class, ir.extractStatement(tryStatement));
        assertEquals(1, t.catchClauses.size());
        assertNotNull(t.finallyBlock);

        SwitchStatement sw = new SwitchStatement(Span.NONE, id("mode"), List.of(
                new SwitchCase(Span.NONE, List.of(), integer(1), List.of(stmt(call("one")))),
                new SwitchDefault(Span.NONE, List.of(), List.of(new BreakStatement(Span.NONE, null)))));
        IrSwitchStatement s = assertInstanceOf(IrSwitchStatement.class, ir.extractStatement(sw));
        assertEquals(2, s.cases.size());
        assertFalse(s.cases.get(0).isDefault);
        assertTrue(s.cases.get(1).isDefault);
    }

    @Test
    public void expressionStatementsAreClassified() {
        IrExtractor ir = newExtractor();
        assertEquals(IrExpressionKind.FRAMEWORK_INITIALIZATION, kindOf(ir, call("runApp", create("App"))));
        assertEquals(IrExpressionKind.SETTER_CALL, kindOf(ir, call("setState", closure(params()))));
        assertEquals(IrExpressionKind.DEBUG_CALL, kindOf(ir, call("print", string("x"))));
        assertEquals(IrExpressionKind.BUILD_CALL, kindOf(ir, call("rebuildAll")));
        assertEquals(IrExpressionKind.METHOD_CALL, kindOf(ir, call("dispose")));
        assertEquals(IrExpressionKind.ERROR_CONSTRUCTION, kindOf(ir, create("ArgumentError")));
        assertEquals(IrExpressionKind.ASYNC_CONSTRUCTION, kindOf(ir, create("Future")));
        assertEquals(IrExpressionKind.OBJECT_CONSTRUCTION, kindOf(ir, create("Point")));
        assertEquals(IrExpressionKind.ARITHMETIC, kindOf(ir, binary(id("a"), "*", id("b"))));
        assertEquals(IrExpressionKind.INCREMENT_DECREMENT, kindOf(ir, postfix(id("i"), "++")));
        assertEquals(IrExpressionKind.CONSTANT_REFERENCE, kindOf(ir, id("Colors")));
        assertEquals(IrExpressionKind.VARIABLE_REFERENCE, kindOf(ir, id("colors")));
        assertEquals(IrExpressionKind.ASSIGNMENT, kindOf(ir, assign(id("x"), "=", integer(1))));
        assertEquals(IrExpressionKind.TERNARY_CONDITIONAL, kindOf(ir, paren(ternary(id("a"), id("b"), id("c")))));
    }

    private static IrExpressionKind kindOf(IrExtractor ir, Expression e) {
        return assertInstanceOf(IrExpressionStatement.class, ir.extractStatement(stmt(e))).classification;
    }

    @Test
    public void constructorInitializersInSourceOrder() {
        ConstructorDeclaration ctor = new ConstructorDeclaration(Span.NONE, "Counter", null, null, List.of(
                new FieldInitializer(Span.NONE, "count", integer(0)),
                new AssertInitializer(Span.NONE, binary(id("count"), ">=", integer(0)), null),
                new SuperConstructorInvocation(Span.NONE, null, args(named("key", id("key"))))),
                null, true, false, null, null);

        List<IrStatement> out = newExtractor().extractConstructorInitializers(ctor);
        assertEquals(3, out.size());

        IrExpressionStatement field = assertInstanceOf(IrExpressionStatement.class, out.get(0));
        assertEquals(IrExpressionKind.ASSIGNMENT, field.classification);
        assertEquals(Boolean.TRUE, field.expression.metadataValue("initializer"));

        IrAssertStatement check = assertInstanceOf(IrAssertStatement.class, out.get(1));
        assertEquals(Boolean.TRUE, check.metadataValue("initializer"));

        IrExpressionStatement superCall = assertInstanceOf(IrExpressionStatement.class, out.get(2));
        assertEquals(IrExpressionKind.SUPER_REFERENCE, superCall.classification);
        IrMethodCallExpression call = assertInstanceOf(IrMethodCallExpression.class, superCall.expression);
        assertInstanceOf(IrSuperExpression.class, call.target);
        assertTrue(call.namedArguments.containsKey("key"));
    }

    @Test
    public void fieldInitializerTargetsThis() {
        ConstructorDeclaration ctor = new ConstructorDeclaration(Span.NONE, "A", "named", null,
                List.of(new FieldInitializer(Span.NONE, "x", integer(1))), null, false, false, null, null);
        IrExpressionStatement s = (IrExpressionStatement) newExtractor().extractConstructorInitializers(ctor).get(0);
        IrPropertyAccessExpression target = assertInstanceOf(IrPropertyAccessExpression.class,
                ((IrAssignmentExpression) s.expression).target);
        assertEquals("x", target.propertyName);
        assertInstanceOf(IrThisExpression.class, target.target);
    }

    @Test
    public void variablesOfFieldsBecomeOneDeclaration() {
        VariableDeclarationList list = new VariableDeclarationList(Span.NONE, "const", false, "int",
                List.of(new VariableDeclaration(Span.NONE, "a", integer(1)), new VariableDeclaration(Span.NONE, "b", null)));
        IrVariableDeclarationStatement s = assertInstanceOf(IrVariableDeclarationStatement.class,
                newExtractor().extractVariables(list));
        assertTrue(s.isConst);
        assertEquals("int", s.typeName);
        assertEquals(2, s.variables.size());
        assertNull(s.variables.get(1).initializer);
    }

    @Test
    public void extractionIsTotal() {
        IrExtractor ir = newExtractor();
        IrUnknownExpression opaque = assertInstanceOf(IrUnknownExpression.class,
                ir.extractExpression(opaque("RecordLiteral", "(1, 2)")));
        assertEquals("Unsupported expression: RecordLiteral", opaque.reason);
        assertEquals("(1, 2)", opaque.source);

        IrUnknownStatement opaqueStmt = assertInstanceOf(IrUnknownStatement.class,
                ir.extractStatement(new OpaqueStatement(Span.NONE, "PatternVariableDeclaration", "var (a, b) = r;")));
        assertEquals("Unsupported statement: PatternVariableDeclaration", opaqueStmt.reason);

        assertEquals("Missing expression", assertInstanceOf(IrUnknownExpression.class, ir.extractExpression(null)).reason);
        assertEquals("Missing statement", assertInstanceOf(IrUnknownStatement.class, ir.extractStatement(null)).reason);

        assertEquals(2, ir.unknownExpressions().size());
        assertEquals(2, ir.unknownStatements().size());
    }

    @Test
    public void failingSubtreeIsContained() {
        IrExtractor ir = newExtractor();
        // malformed: the identifier half is missing
        Expression broken = new PrefixedIdentifier(Span.NONE, id("widget"), null);
        IrMethodCallExpression call = assertInstanceOf(IrMethodCallExpression.class,
                ir.extractExpression(call("show", broken, integer(1))));

        IrUnknownExpression failed = assertInstanceOf(IrUnknownExpression.class, call.arguments.get(0));
        assertTrue(failed.reason.startsWith("Extraction failed: NullPointerException"));
        assertTrue(failed.metadata.containsKey("error"));
        assertInstanceOf(IrLiteralExpression.class, call.arguments.get(1));
        assertEquals(1, ir.unknownExpressions().size());
    }

    @Test
    public void idsCarryTheFileContextAndAreUnique() {
        IrExtractor ir = newExtractor();
        IrExpression a = ir.extractExpression(id("a"));
        IrExpression b = ir.extractExpression(id("a"));
        assertNotEquals(a.id, b.id);
        String hash = new IrIdGenerator("lib/main.dart").contextHash();
        assertTrue(a.id.startsWith("identifier_" + hash + "_a_"));
    }
}
