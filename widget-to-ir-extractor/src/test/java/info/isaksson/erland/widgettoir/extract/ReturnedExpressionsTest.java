package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.syntax.BreakStatement;
import info.isaksson.erland.widgettoir.syntax.CatchClause;
import info.isaksson.erland.widgettoir.syntax.EmptyFunctionBody;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.FunctionBody;
import info.isaksson.erland.widgettoir.syntax.SimpleIdentifier;
import info.isaksson.erland.widgettoir.syntax.Span;
import info.isaksson.erland.widgettoir.syntax.SwitchCase;
import info.isaksson.erland.widgettoir.syntax.SwitchDefault;
import info.isaksson.erland.widgettoir.syntax.SwitchStatement;
import info.isaksson.erland.widgettoir.syntax.TryStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static info.isaksson.erland.widgettoir.syntax.Syntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class ReturnedExpressionsTest {

    @Test
    public void arrowBodyReturnsItsExpression() {
        Expression e = create("Text", string("hi"));
        assertEquals(List.of(e), ReturnedExpressions.of(arrowBody(e)));
    }

    @Test
    public void collectsReturnsInSourceOrderThroughNestedStatements() {
        TryStatement t = new TryStatement(Span.NONE, block(ret(id("fromTry"))),
                List.of(new CatchClause(Span.NONE, null, "e", null, block(ret(id("fromCatch"))))),
                block(ret(id("fromFinally"))));
        SwitchStatement sw = new SwitchStatement(Span.NONE, id("mode"), List.of(
                new SwitchCase(Span.NONE, List.of(), integer(1), List.of(ret(id("fromCase")))),
                new SwitchDefault(Span.NONE, List.of(), List.of(new BreakStatement(Span.NONE, null)))));

        List<Expression> out = ReturnedExpressions.of(blockBody(
                ifStatement(id("a"), ret(id("fromThen")), block(ret(id("fromElse")))),
                forInStatement("x", id("xs"), ret(id("fromLoop"))),
                whileStatement(bool(true), ret(id("fromWhile"))),
                t, sw,
                ret(null),
                ret(id("last"))));

        assertEquals(List.of("fromThen", "fromElse", "fromLoop", "fromWhile", "fromTry", "fromCatch",
                "fromFinally", "fromCase", "last"), names(out));
    }

    @Test
    public void doesNotEnterClosures() {
        List<Expression> out = ReturnedExpressions.of(blockBody(
                stmt(call("run", closure(params(), ret(id("inner"))))),
                ret(id("outer"))));
        assertEquals(List.of("outer"), names(out));
    }

    @Test
    public void emptyForMissingOrBodilessFunctions() {
        assertTrue(ReturnedExpressions.of((FunctionBody) null).isEmpty());
        assertTrue(ReturnedExpressions.of(new EmptyFunctionBody(Span.NONE)).isEmpty());
        assertTrue(ReturnedExpressions.of(blockBody()).isEmpty());
    }

    private static List<String> names(List<Expression> expressions) {
        return expressions.stream().map(e -> ((SimpleIdentifier) e).name()).collect(Collectors.toList());
    }
}
