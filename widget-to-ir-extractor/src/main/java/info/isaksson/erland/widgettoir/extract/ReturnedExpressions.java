package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.syntax.Block;
import info.isaksson.erland.widgettoir.syntax.BlockFunctionBody;
import info.isaksson.erland.widgettoir.syntax.CatchClause;
import info.isaksson.erland.widgettoir.syntax.DoStatement;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.ExpressionFunctionBody;
import info.isaksson.erland.widgettoir.syntax.ForStatement;
import info.isaksson.erland.widgettoir.syntax.FunctionBody;
import info.isaksson.erland.widgettoir.syntax.IfStatement;
import info.isaksson.erland.widgettoir.syntax.LabeledStatement;
import info.isaksson.erland.widgettoir.syntax.ReturnStatement;
import info.isaksson.erland.widgettoir.syntax.Statement;
import info.isaksson.erland.widgettoir.syntax.SwitchMember;
import info.isaksson.erland.widgettoir.syntax.SwitchStatement;
import info.isaksson.erland.widgettoir.syntax.TryStatement;
import info.isaksson.erland.widgettoir.syntax.WhileStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Values a function body can return, in source order: the arrow expression, or the operand of
 * every {@code return value;} reachable through nested statements. Nested closures and local
 * functions are not entered.
 */
public final class ReturnedExpressions {

    private ReturnedExpressions() {}

    public static List<Expression> of(FunctionBody body) {
        List<Expression> out = new ArrayList<>();
        if (body instanceof ExpressionFunctionBody arrow) {
            if (arrow.expression() != null) out.add(arrow.expression());
        } else if (body instanceof BlockFunctionBody block) {
            collect(block.block(), out);
        }
        return out;
    }

    public static List<Expression> of(Statement statement) {
        List<Expression> out = new ArrayList<>();
        collect(statement, out);
        return out;
    }

    private static void collect(Statement s, List<Expression> out) {
        if (s == null) return;
        if (s instanceof ReturnStatement r) {
            if (r.expression() != null) out.add(r.expression());
        } else if (s instanceof Block b) {
            for (Statement inner : b.statements()) collect(inner, out);
        } else if (s instanceof IfStatement i) {
            collect(i.thenStatement(), out);
            collect(i.elseStatement(), out);
        } else if (s instanceof ForStatement f) {
            collect(f.body(), out);
        } else if (s instanceof WhileStatement w) {
            collect(w.body(), out);
        } else if (s instanceof DoStatement d) {
            collect(d.body(), out);
        } else if (s instanceof LabeledStatement l) {
            collect(l.statement(), out);
        } else if (s instanceof TryStatement t) {
            collect(t.body(), out);
            for (CatchClause c : t.catchClauses()) collect(c.body(), out);
            collect(t.finallyBlock(), out);
        } else if (s instanceof SwitchStatement sw) {
            for (SwitchMember m : sw.members()) {
                for (Statement inner : StatementExtractor.memberStatements(m)) collect(inner, out);
            }
        }
    }
}
