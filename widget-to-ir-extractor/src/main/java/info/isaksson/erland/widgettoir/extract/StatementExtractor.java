package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.ir.expr.IrAssignmentExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrConstantPattern;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrMethodCallExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrPattern;
import info.isaksson.erland.widgettoir.ir.expr.IrPropertyAccessExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSuperExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrThisExpression;
import info.isaksson.erland.widgettoir.ir.stmt.IrAssertStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrBlockStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrBreakStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrCatchClause;
import info.isaksson.erland.widgettoir.ir.stmt.IrContinueStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrDoWhileStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrEmptyStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrExpressionKind;
import info.isaksson.erland.widgettoir.ir.stmt.IrExpressionStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrForEachStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrForStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrFunctionDeclarationStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrIfStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrLabeledStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrReturnStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrSwitchCase;
import info.isaksson.erland.widgettoir.ir.stmt.IrSwitchStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrThrowStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrTryStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrUnknownStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrVariableDeclarationStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrVariableDeclarator;
import info.isaksson.erland.widgettoir.ir.stmt.IrWhileStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrYieldStatement;
import info.isaksson.erland.widgettoir.syntax.AssertInitializer;
import info.isaksson.erland.widgettoir.syntax.AssertStatement;
import info.isaksson.erland.widgettoir.syntax.Block;
import info.isaksson.erland.widgettoir.syntax.BreakStatement;
import info.isaksson.erland.widgettoir.syntax.CatchClause;
import info.isaksson.erland.widgettoir.syntax.ConstructorInitializer;
import info.isaksson.erland.widgettoir.syntax.ContinueStatement;
import info.isaksson.erland.widgettoir.syntax.DoStatement;
import info.isaksson.erland.widgettoir.syntax.EmptyStatement;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.ExpressionFunctionBody;
import info.isaksson.erland.widgettoir.syntax.ExpressionStatement;
import info.isaksson.erland.widgettoir.syntax.FieldInitializer;
import info.isaksson.erland.widgettoir.syntax.ForEachParts;
import info.isaksson.erland.widgettoir.syntax.ForEachPartsWithDeclaration;
import info.isaksson.erland.widgettoir.syntax.ForParts;
import info.isaksson.erland.widgettoir.syntax.ForPartsWithDeclarations;
import info.isaksson.erland.widgettoir.syntax.ForPartsWithExpressions;
import info.isaksson.erland.widgettoir.syntax.ForStatement;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclaration;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclarationStatement;
import info.isaksson.erland.widgettoir.syntax.IfStatement;
import info.isaksson.erland.widgettoir.syntax.LabeledStatement;
import info.isaksson.erland.widgettoir.syntax.OpaqueStatement;
import info.isaksson.erland.widgettoir.syntax.RedirectingConstructorInvocation;
import info.isaksson.erland.widgettoir.syntax.RethrowExpression;
import info.isaksson.erland.widgettoir.syntax.ReturnStatement;
import info.isaksson.erland.widgettoir.syntax.Statement;
import info.isaksson.erland.widgettoir.syntax.StatementVisitor;
import info.isaksson.erland.widgettoir.syntax.SuperConstructorInvocation;
import info.isaksson.erland.widgettoir.syntax.SwitchCase;
import info.isaksson.erland.widgettoir.syntax.SwitchDefault;
import info.isaksson.erland.widgettoir.syntax.SwitchMember;
import info.isaksson.erland.widgettoir.syntax.SwitchPatternCase;
import info.isaksson.erland.widgettoir.syntax.SwitchStatement;
import info.isaksson.erland.widgettoir.syntax.ThrowExpression;
import info.isaksson.erland.widgettoir.syntax.TryStatement;
import info.isaksson.erland.widgettoir.syntax.VariableDeclaration;
import info.isaksson.erland.widgettoir.syntax.VariableDeclarationList;
import info.isaksson.erland.widgettoir.syntax.VariableDeclarationStatement;
import info.isaksson.erland.widgettoir.syntax.WhileStatement;
import info.isaksson.erland.widgettoir.syntax.YieldStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Statement half of the normalizer. */
final class StatementExtractor implements StatementVisitor<IrStatement> {

    private final IrExtractor ir;
    private final ExpressionStatementClassifier classifier = new ExpressionStatementClassifier();

    StatementExtractor(IrExtractor ir) {
        this.ir = ir;
    }

    @Override
    public IrStatement visitBlock(Block node) {
        return block(node);
    }

    @Override
    public IrStatement visitVariableDeclarationStatement(VariableDeclarationStatement node) {
        return variables(node.variables(), node);
    }

    IrVariableDeclarationStatement variables(VariableDeclarationList list, Statement owner) {
        List<IrVariableDeclarator> declarators = new ArrayList<>();
        for (VariableDeclaration v : list.variables()) {
            IrExpression init = v.initializer() == null ? null : ir.extractExpression(v.initializer());
            declarators.add(new IrVariableDeclarator(v.name(), init));
        }
        String id = declarators.isEmpty() ? ir.nextId("var") : ir.nextId("var", declarators.get(0).name);
        return new IrVariableDeclarationStatement(id, ir.locate(owner == null ? list : owner), Map.of(),
                declarators, list.type(), list.isFinal(), list.isConst(), list.isLate());
    }

    /** {@code throw x;} is an expression statement in the source language; it gets its own IR form. */
    @Override
    public IrStatement visitExpressionStatement(ExpressionStatement node) {
        Expression e = node.expression() == null ? null : node.expression().unparenthesized();
        if (e instanceof ThrowExpression t) {
            return new IrThrowStatement(ir.nextId("throw"), ir.locate(node), Map.of(), ir.extractExpression(t.expression()), false);
        }
        if (e instanceof RethrowExpression) {
            return new IrThrowStatement(ir.nextId("throw"), ir.locate(node), Map.of(), null, true);
        }
        IrExpressionKind kind = e == null ? IrExpressionKind.UNKNOWN_EXPRESSION : e.accept(classifier);
        return new IrExpressionStatement(ir.nextId("exprStmt"), ir.locate(node), Map.of(),
                ir.extractExpression(node.expression()), kind);
    }

    @Override
    public IrStatement visitReturnStatement(ReturnStatement node) {
        IrExpression value = node.expression() == null ? null : ir.extractExpression(node.expression());
        return new IrReturnStatement(ir.nextId("return"), ir.locate(node), Map.of(), value);
    }

    IrReturnStatement returnOf(ExpressionFunctionBody body) {
        return new IrReturnStatement(ir.nextId("return"), ir.locate(body), Map.of("fromArrow", true),
                ir.extractExpression(body.expression()));
    }

    @Override
    public IrStatement visitIfStatement(IfStatement node) {
        IrExpression condition = ir.expressions().condition(node.condition(), node.caseClause());
        IrStatement otherwise = node.elseStatement() == null ? null : ir.extractStatement(node.elseStatement());
        return new IrIfStatement(ir.nextId("if"), ir.locate(node), Map.of(), condition,
                ir.extractStatement(node.thenStatement()), otherwise);
    }

    @Override
    public IrStatement visitForStatement(ForStatement node) {
        if (node.parts() instanceof ForEachParts each) {
            String type = each instanceof ForEachPartsWithDeclaration d ? d.loopVariable().type() : null;
            return new IrForEachStatement(ir.nextId("forEach", each.variableName()), ir.locate(node), Map.of(),
                    each.variableName(), type, ir.extractExpression(each.iterable()),
                    ir.extractStatement(node.body()), node.isAwait());
        }
        ForParts parts = (ForParts) node.parts();
        List<IrStatement> init = new ArrayList<>();
        if (parts instanceof ForPartsWithDeclarations d && d.variables() != null) {
            init.add(variables(d.variables(), null));
        } else if (parts instanceof ForPartsWithExpressions x && x.initialization() != null) {
            init.add(new IrExpressionStatement(ir.nextId("exprStmt"), ir.locate(x.initialization()), Map.of(),
                    ir.extractExpression(x.initialization()), x.initialization().unparenthesized().accept(classifier)));
        }
        List<IrExpression> updaters = new ArrayList<>();
        for (Expression u : parts.updaters()) {
            updaters.add(ir.extractExpression(u));
        }
        IrExpression condition = parts.condition() == null ? null : ir.extractExpression(parts.condition());
        return new IrForStatement(ir.nextId("for"), ir.locate(node), Map.of(), init, condition, updaters,
                ir.extractStatement(node.body()));
    }

    @Override
    public IrStatement visitWhileStatement(WhileStatement node) {
        return new IrWhileStatement(ir.nextId("while"), ir.locate(node), Map.of(),
                ir.extractExpression(node.condition()), ir.extractStatement(node.body()));
    }

    @Override
    public IrStatement visitDoStatement(DoStatement node) {
        return new IrDoWhileStatement(ir.nextId("doWhile"), ir.locate(node), Map.of(),
                ir.extractStatement(node.body()), ir.extractExpression(node.condition()));
    }

    @Override
    public IrStatement visitTryStatement(TryStatement node) {
        List<IrCatchClause> clauses = new ArrayList<>();
        for (CatchClause c : node.catchClauses()) {
            IrBlockStatement body;
            try {
                body = block(c.body());
            } catch (RuntimeException e) {
                IrUnknownStatement failed = ir.unknownStatement(c, IrExtractor.errorReason(e),
                        Map.of(IrExtractor.ERROR_KEY, String.valueOf(e.getMessage())));
                body = new IrBlockStatement(ir.nextId("block"), ir.locate(c), Map.of(), List.of(failed));
            }
            clauses.add(new IrCatchClause(c.exceptionType(), c.exceptionParameter(), c.stackTraceParameter(), body));
        }
        IrBlockStatement finallyBlock = node.finallyBlock() == null ? null : block(node.finallyBlock());
        return new IrTryStatement(ir.nextId("try"), ir.locate(node), Map.of(), block(node.body()), clauses, finallyBlock);
    }

    @Override
    public IrStatement visitSwitchStatement(SwitchStatement node) {
        List<IrSwitchCase> cases = new ArrayList<>();
        for (SwitchMember m : node.members()) {
            try {
                cases.add(switchCase(m));
            } catch (RuntimeException e) {
                IrUnknownStatement failed = ir.unknownStatement(m, IrExtractor.errorReason(e),
                        Map.of(IrExtractor.ERROR_KEY, String.valueOf(e.getMessage())));
                cases.add(new IrSwitchCase(List.of(), null, null, m instanceof SwitchDefault, List.of(failed)));
            }
        }
        return new IrSwitchStatement(ir.nextId("switch"), ir.locate(node), Map.of(),
                ir.extractExpression(node.expression()), cases);
    }

    private IrSwitchCase switchCase(SwitchMember member) {
        List<IrStatement> body = new ArrayList<>();
        for (Statement s : memberStatements(member)) {
            body.add(ir.extractStatement(s));
        }
        if (member instanceof SwitchCase c) {
            IrPattern pattern = new IrConstantPattern(ir.nextId("pattern"), ir.locate(c.expression()),
                    ir.extractExpression(c.expression()));
            return new IrSwitchCase(c.labels(), pattern, null, false, body);
        }
        if (member instanceof SwitchPatternCase p) {
            Expression when = p.guardedPattern().whenClause();
            return new IrSwitchCase(p.labels(), ir.extractPattern(p.guardedPattern().pattern()),
                    when == null ? null : ir.extractExpression(when), false, body);
        }
        return new IrSwitchCase(((SwitchDefault) member).labels(), null, null, true, body);
    }

    static List<Statement> memberStatements(SwitchMember member) {
        if (member instanceof SwitchCase c) return c.statements();
        if (member instanceof SwitchPatternCase p) return p.statements();
        return ((SwitchDefault) member).statements();
    }

    @Override
    public IrStatement visitBreakStatement(BreakStatement node) {
        return new IrBreakStatement(ir.nextId("break"), ir.locate(node), Map.of(), node.label());
    }

    @Override
    public IrStatement visitContinueStatement(ContinueStatement node) {
        return new IrContinueStatement(ir.nextId("continue"), ir.locate(node), Map.of(), node.label());
    }

    @Override
    public IrStatement visitAssertStatement(AssertStatement node) {
        IrExpression message = node.message() == null ? null : ir.extractExpression(node.message());
        return new IrAssertStatement(ir.nextId("assert"), ir.locate(node), Map.of(),
                ir.extractExpression(node.condition()), message);
    }

    @Override
    public IrStatement visitLabeledStatement(LabeledStatement node) {
        return new IrLabeledStatement(ir.nextId("labeled"), ir.locate(node), Map.of(), node.labels(),
                ir.extractStatement(node.statement()));
    }

    @Override
    public IrStatement visitYieldStatement(YieldStatement node) {
        return new IrYieldStatement(ir.nextId("yield"), ir.locate(node), Map.of(),
                ir.extractExpression(node.expression()), node.star());
    }

    @Override
    public IrStatement visitFunctionDeclarationStatement(FunctionDeclarationStatement node) {
        FunctionDeclaration fn = node.function();
        if (fn == null || fn.function() == null) return ir.unknownStatement(node, "Function declaration without a body");
        return new IrFunctionDeclarationStatement(ir.nextId("function", fn.name()), ir.locate(node), Map.of(),
                fn.name(), fn.returnType(), ir.extractFunction(fn.function()));
    }

    @Override
    public IrStatement visitEmptyStatement(EmptyStatement node) {
        return new IrEmptyStatement(ir.nextId("empty"), ir.locate(node), Map.of());
    }

    @Override
    public IrStatement visitOpaqueStatement(OpaqueStatement node) {
        return ir.unknownStatement(node, "Unsupported statement: " + node.nodeType());
    }

    // ---------------------------------------------------------------------------------------------
    // Constructor initializers
    // ---------------------------------------------------------------------------------------------

    /**
     * {@code x = v} becomes {@code this.x = v}; {@code super(..)} and {@code this.named(..)} become
     * calls on a super/this target; {@code assert(..)} becomes an assert statement.
     */
    IrStatement initializer(ConstructorInitializer init) {
        if (init instanceof FieldInitializer f) {
            IrExpression target = new IrPropertyAccessExpression(ir.nextId("property", f.fieldName()), ir.locate(f), Map.of(),
                    new IrThisExpression(ir.nextId("this"), ir.locate(f), Map.of()), f.fieldName(), false);
            IrExpression assign = new IrAssignmentExpression(ir.nextId("assign"), ir.locate(f), Map.of("initializer", true),
                    target, ir.extractExpression(f.expression()));
            return new IrExpressionStatement(ir.nextId("exprStmt"), ir.locate(f), Map.of(), assign, IrExpressionKind.ASSIGNMENT);
        }
        if (init instanceof SuperConstructorInvocation s) {
            IrExpression call = constructorCall(new IrSuperExpression(ir.nextId("super"), ir.locate(s), Map.of()),
                    s.constructorName(), s);
            return new IrExpressionStatement(ir.nextId("exprStmt"), ir.locate(s), Map.of(), call, IrExpressionKind.SUPER_REFERENCE);
        }
        if (init instanceof RedirectingConstructorInvocation r) {
            IrExpression call = constructorCall(new IrThisExpression(ir.nextId("this"), ir.locate(r), Map.of()),
                    r.constructorName(), r);
            return new IrExpressionStatement(ir.nextId("exprStmt"), ir.locate(r), Map.of(), call, IrExpressionKind.SELF_REFERENCE);
        }
        AssertInitializer a = (AssertInitializer) init;
        IrExpression message = a.message() == null ? null : ir.extractExpression(a.message());
        return new IrAssertStatement(ir.nextId("assert"), ir.locate(a), Map.of("initializer", true),
                ir.extractExpression(a.condition()), message);
    }

    private IrExpression constructorCall(IrExpression target, String constructorName, ConstructorInitializer node) {
        ExpressionExtractor expressions = ir.expressions();
        var args = node instanceof SuperConstructorInvocation s ? s.arguments() : ((RedirectingConstructorInvocation) node).arguments();
        String name = constructorName == null ? "" : constructorName;
        return new IrMethodCallExpression(ir.nextId("call", name.isEmpty() ? "constructor" : name), ir.locate(node),
                Map.of("constructorInitializer", true), target, name,
                expressions.positional(args), expressions.named(args), List.of(), false, false);
    }

    private IrBlockStatement block(Block node) {
        List<IrStatement> out = new ArrayList<>();
        for (Statement s : node.statements()) {
            out.add(ir.extractStatement(s));
        }
        return new IrBlockStatement(ir.nextId("block"), ir.locate(node), Map.of(), out);
    }
}
