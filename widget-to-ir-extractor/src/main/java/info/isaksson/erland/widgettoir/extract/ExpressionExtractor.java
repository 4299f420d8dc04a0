package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.ir.expr.IrAssignmentExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrAwaitExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrBinaryExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrBinaryOperator;
import info.isaksson.erland.widgettoir.ir.expr.IrCascadeExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrCastExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrCompoundAssignmentExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrConditionalExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrConstantPattern;
import info.isaksson.erland.widgettoir.ir.expr.IrConstructorCallExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrIdentifierExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrIndexAccessExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrInterpolationPart;
import info.isaksson.erland.widgettoir.ir.expr.IrLambdaExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrListLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrLiteralKind;
import info.isaksson.erland.widgettoir.ir.expr.IrMapEntry;
import info.isaksson.erland.widgettoir.ir.expr.IrMapLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrMethodCallExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrNullCoalescingExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrParameter;
import info.isaksson.erland.widgettoir.ir.expr.IrParameterKind;
import info.isaksson.erland.widgettoir.ir.expr.IrPattern;
import info.isaksson.erland.widgettoir.ir.expr.IrPatternMatchExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrPropertyAccessExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSetLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSkippedElementExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrStringInterpolationExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSuperExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSwitchExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrSwitchExpressionCase;
import info.isaksson.erland.widgettoir.ir.expr.IrThisExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrThrowExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrTypeCheckExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrUnaryExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrUnaryOperator;
import info.isaksson.erland.widgettoir.ir.expr.IrUnknownPattern;
import info.isaksson.erland.widgettoir.ir.expr.IrVariablePattern;
import info.isaksson.erland.widgettoir.ir.expr.IrWildcardPattern;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;
import info.isaksson.erland.widgettoir.syntax.ArgumentList;
import info.isaksson.erland.widgettoir.syntax.AsExpression;
import info.isaksson.erland.widgettoir.syntax.AssignmentExpression;
import info.isaksson.erland.widgettoir.syntax.AwaitExpression;
import info.isaksson.erland.widgettoir.syntax.BinaryExpression;
import info.isaksson.erland.widgettoir.syntax.BlockFunctionBody;
import info.isaksson.erland.widgettoir.syntax.BooleanLiteral;
import info.isaksson.erland.widgettoir.syntax.CascadeExpression;
import info.isaksson.erland.widgettoir.syntax.CaseClause;
import info.isaksson.erland.widgettoir.syntax.CollectionElement;
import info.isaksson.erland.widgettoir.syntax.ConditionalExpression;
import info.isaksson.erland.widgettoir.syntax.ConstantPattern;
import info.isaksson.erland.widgettoir.syntax.DeclaredVariablePattern;
import info.isaksson.erland.widgettoir.syntax.DoubleLiteral;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.ExpressionFunctionBody;
import info.isaksson.erland.widgettoir.syntax.ExpressionVisitor;
import info.isaksson.erland.widgettoir.syntax.ForElement;
import info.isaksson.erland.widgettoir.syntax.FormalParameter;
import info.isaksson.erland.widgettoir.syntax.FunctionExpression;
import info.isaksson.erland.widgettoir.syntax.FunctionExpressionInvocation;
import info.isaksson.erland.widgettoir.syntax.IfElement;
import info.isaksson.erland.widgettoir.syntax.IndexExpression;
import info.isaksson.erland.widgettoir.syntax.InstanceCreationExpression;
import info.isaksson.erland.widgettoir.syntax.IntegerLiteral;
import info.isaksson.erland.widgettoir.syntax.InterpolationElement;
import info.isaksson.erland.widgettoir.syntax.InterpolationExpression;
import info.isaksson.erland.widgettoir.syntax.InterpolationString;
import info.isaksson.erland.widgettoir.syntax.IsExpression;
import info.isaksson.erland.widgettoir.syntax.ListLiteral;
import info.isaksson.erland.widgettoir.syntax.MapLiteralEntry;
import info.isaksson.erland.widgettoir.syntax.MethodInvocation;
import info.isaksson.erland.widgettoir.syntax.NamedExpression;
import info.isaksson.erland.widgettoir.syntax.NullLiteral;
import info.isaksson.erland.widgettoir.syntax.OpaqueExpression;
import info.isaksson.erland.widgettoir.syntax.OpaquePattern;
import info.isaksson.erland.widgettoir.syntax.ParenthesizedExpression;
import info.isaksson.erland.widgettoir.syntax.PatternNode;
import info.isaksson.erland.widgettoir.syntax.PostfixExpression;
import info.isaksson.erland.widgettoir.syntax.PrefixExpression;
import info.isaksson.erland.widgettoir.syntax.PrefixedIdentifier;
import info.isaksson.erland.widgettoir.syntax.PropertyAccess;
import info.isaksson.erland.widgettoir.syntax.RethrowExpression;
import info.isaksson.erland.widgettoir.syntax.SetOrMapLiteral;
import info.isaksson.erland.widgettoir.syntax.SimpleIdentifier;
import info.isaksson.erland.widgettoir.syntax.SimpleStringLiteral;
import info.isaksson.erland.widgettoir.syntax.SpreadElement;
import info.isaksson.erland.widgettoir.syntax.StringInterpolation;
import info.isaksson.erland.widgettoir.syntax.SuperExpression;
import info.isaksson.erland.widgettoir.syntax.SwitchExpression;
import info.isaksson.erland.widgettoir.syntax.SwitchExpressionCase;
import info.isaksson.erland.widgettoir.syntax.SyntaxPrinter;
import info.isaksson.erland.widgettoir.syntax.ThisExpression;
import info.isaksson.erland.widgettoir.syntax.ThrowExpression;
import info.isaksson.erland.widgettoir.syntax.WildcardPattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expression half of the normalizer. Recursion into sub-expressions always goes back through
 * {@link IrExtractor#extractExpression}, which is where failures are contained.
 */
final class ExpressionExtractor implements ExpressionVisitor<IrExpression> {

    static final String IS_SPREAD = "isSpread";
    static final String NULL_AWARE_SPREAD = "nullAwareSpread";
    static final String FROM_COLLECTION_IF = "fromCollectionIf";
    static final String THEN_IS_SPREAD = "thenIsSpread";
    static final String ELSE_IS_SPREAD = "elseIsSpread";

    static final String IS_ARROW = "isArrow";
    static final String STATEMENT_COUNT = "statementCount";
    static final String IS_ASYNC = "isAsync";
    static final String IS_GENERATOR = "isGenerator";
    static final String PARAMETER_ORIGINS = "parameterOrigins";

    static final String DYNAMIC = "dynamic";

    private final IrExtractor ir;

    ExpressionExtractor(IrExtractor ir) {
        this.ir = ir;
    }

    // ---------------------------------------------------------------------------------------------
    // Literals and references
    // ---------------------------------------------------------------------------------------------

    @Override
    public IrExpression visitIntegerLiteral(IntegerLiteral node) {
        return literal(node, node.value(), IrLiteralKind.INTEGER);
    }

    @Override
    public IrExpression visitDoubleLiteral(DoubleLiteral node) {
        return literal(node, node.value(), IrLiteralKind.DOUBLE);
    }

    @Override
    public IrExpression visitBooleanLiteral(BooleanLiteral node) {
        return literal(node, node.value(), IrLiteralKind.BOOLEAN);
    }

    @Override
    public IrExpression visitNullLiteral(NullLiteral node) {
        return literal(node, null, IrLiteralKind.NULL);
    }

    @Override
    public IrExpression visitSimpleStringLiteral(SimpleStringLiteral node) {
        return literal(node, node.value(), IrLiteralKind.STRING);
    }

    @Override
    public IrExpression visitStringInterpolation(StringInterpolation node) {
        List<IrInterpolationPart> parts = new ArrayList<>();
        for (InterpolationElement e : node.elements()) {
            if (e instanceof InterpolationString s) {
                // the front-end emits empty text around leading/trailing embeds
                if (s.value() != null && !s.value().isEmpty()) parts.add(IrInterpolationPart.text(s.value()));
            } else {
                parts.add(IrInterpolationPart.expression(ir.extractExpression(((InterpolationExpression) e).expression())));
            }
        }
        return new IrStringInterpolationExpression(ir.nextId("interpolation"), ir.locate(node), Map.of(), parts);
    }

    @Override
    public IrExpression visitSimpleIdentifier(SimpleIdentifier node) {
        return new IrIdentifierExpression(ir.nextId("identifier", node.name()), ir.locate(node), Map.of(),
                node.name(), node.library());
    }

    @Override
    public IrExpression visitPrefixedIdentifier(PrefixedIdentifier node) {
        IrExpression target = ir.extractExpression(node.prefix());
        return new IrPropertyAccessExpression(ir.nextId("property", node.identifier().name()), ir.locate(node),
                Map.of("prefixed", true), target, node.identifier().name(), false);
    }

    @Override
    public IrExpression visitThisExpression(ThisExpression node) {
        return new IrThisExpression(ir.nextId("this"), ir.locate(node), Map.of());
    }

    @Override
    public IrExpression visitSuperExpression(SuperExpression node) {
        return new IrSuperExpression(ir.nextId("super"), ir.locate(node), Map.of());
    }

    // ---------------------------------------------------------------------------------------------
    // Operators
    // ---------------------------------------------------------------------------------------------

    @Override
    public IrExpression visitBinaryExpression(BinaryExpression node) {
        IrBinaryOperator op = IrBinaryOperator.fromLexeme(node.operator());
        if (op == null) return ir.unknownExpression(node, "Unsupported binary operator: " + node.operator());
        IrExpression left = ir.extractExpression(node.left());
        IrExpression right = ir.extractExpression(node.right());
        if (op == IrBinaryOperator.NULL_COALESCE) {
            return new IrNullCoalescingExpression(ir.nextId("nullCoalesce"), ir.locate(node), Map.of(), left, right);
        }
        return new IrBinaryExpression(ir.nextId("binary"), ir.locate(node), Map.of(), left, op, right);
    }

    @Override
    public IrExpression visitPrefixExpression(PrefixExpression node) {
        IrUnaryOperator op = IrUnaryOperator.fromLexeme(node.operator());
        if (op == null) return ir.unknownExpression(node, "Unsupported prefix operator: " + node.operator());
        return new IrUnaryExpression(ir.nextId("unary"), ir.locate(node), Map.of(), op,
                ir.extractExpression(node.operand()), true);
    }

    /** {@code x!} keeps the operand, tagged; {@code x++} / {@code x--} become postfix unary nodes. */
    @Override
    public IrExpression visitPostfixExpression(PostfixExpression node) {
        if ("!".equals(node.operator())) {
            return ir.extractExpression(node.operand()).withMetadata("nullAssert", true);
        }
        IrUnaryOperator op = IrUnaryOperator.fromLexeme(node.operator());
        if (op == null || !op.isIncrementOrDecrement()) {
            return ir.unknownExpression(node, "Unsupported postfix operator: " + node.operator());
        }
        return new IrUnaryExpression(ir.nextId("unary"), ir.locate(node), Map.of(), op,
                ir.extractExpression(node.operand()), false);
    }

    @Override
    public IrExpression visitAssignmentExpression(AssignmentExpression node) {
        String lexeme = node.operator() == null ? "=" : node.operator().trim();
        if ("=".equals(lexeme)) {
            return new IrAssignmentExpression(ir.nextId("assign"), ir.locate(node), Map.of(),
                    ir.extractExpression(node.left()), ir.extractExpression(node.right()));
        }
        IrBinaryOperator op = IrBinaryOperator.fromCompoundAssignment(lexeme);
        if (op == null) return ir.unknownExpression(node, "Unsupported assignment operator: " + lexeme);
        return new IrCompoundAssignmentExpression(ir.nextId("assign"), ir.locate(node), Map.of(),
                ir.extractExpression(node.left()), op, ir.extractExpression(node.right()));
    }

    @Override
    public IrExpression visitConditionalExpression(ConditionalExpression node) {
        return new IrConditionalExpression(ir.nextId("conditional"), ir.locate(node), Map.of(),
                ir.extractExpression(node.condition()),
                ir.extractExpression(node.thenExpression()),
                ir.extractExpression(node.elseExpression()));
    }

    // ---------------------------------------------------------------------------------------------
    // Calls and access
    // ---------------------------------------------------------------------------------------------

    @Override
    public IrExpression visitMethodInvocation(MethodInvocation node) {
        IrExpression target = node.target() == null ? null : ir.extractExpression(node.target());
        return new IrMethodCallExpression(ir.nextId("call", node.methodName()), ir.locate(node), Map.of(),
                target, node.methodName(), positional(node.arguments()), named(node.arguments()),
                node.typeArguments(), node.isNullAware(), node.isCascaded());
    }

    @Override
    public IrExpression visitFunctionExpressionInvocation(FunctionExpressionInvocation node) {
        return new IrMethodCallExpression(ir.nextId("call", "call"), ir.locate(node), Map.of("functionInvocation", true),
                ir.extractExpression(node.function()), "call", positional(node.arguments()), named(node.arguments()),
                node.typeArguments(), false, false);
    }

    @Override
    public IrExpression visitInstanceCreationExpression(InstanceCreationExpression node) {
        return new IrConstructorCallExpression(ir.nextId("new", node.typeName()), ir.locate(node), Map.of(),
                node.typeName(), node.constructorName(), positional(node.arguments()), named(node.arguments()),
                node.typeArguments(), node.isConst());
    }

    @Override
    public IrExpression visitPropertyAccess(PropertyAccess node) {
        IrExpression target = node.target() == null ? null : ir.extractExpression(node.target());
        Map<String, Object> meta = node.isCascaded() ? Map.of("cascade", true) : Map.of();
        return new IrPropertyAccessExpression(ir.nextId("property", node.propertyName()), ir.locate(node), meta,
                target, node.propertyName(), node.isNullAware());
    }

    @Override
    public IrExpression visitIndexExpression(IndexExpression node) {
        IrExpression target = node.target() == null ? null : ir.extractExpression(node.target());
        return new IrIndexAccessExpression(ir.nextId("index"), ir.locate(node), Map.of(),
                target, ir.extractExpression(node.index()), node.nullAware());
    }

    @Override
    public IrExpression visitCascadeExpression(CascadeExpression node) {
        List<IrExpression> sections = new ArrayList<>();
        for (Expression s : node.sections()) {
            sections.add(ir.extractExpression(s));
        }
        return new IrCascadeExpression(ir.nextId("cascade"), ir.locate(node), Map.of(),
                ir.extractExpression(node.target()), sections, node.nullAware());
    }

    // ---------------------------------------------------------------------------------------------
    // Collections
    // ---------------------------------------------------------------------------------------------

    @Override
    public IrExpression visitListLiteral(ListLiteral node) {
        return new IrListLiteralExpression(ir.nextId("list"), ir.locate(node), Map.of(),
                elements(node.elements()), typeArgument(node.typeArguments(), 0), node.isConst());
    }

    @Override
    public IrExpression visitSetOrMapLiteral(SetOrMapLiteral node) {
        if (!node.isMap()) {
            return new IrSetLiteralExpression(ir.nextId("set"), ir.locate(node), Map.of(),
                    elements(node.elements()), typeArgument(node.typeArguments(), 0), node.isConst());
        }
        List<IrMapEntry> entries = new ArrayList<>();
        List<IrExpression> others = new ArrayList<>();
        for (CollectionElement e : node.elements()) {
            if (e instanceof MapLiteralEntry entry) {
                entries.add(new IrMapEntry(ir.extractExpression(entry.key()), ir.extractExpression(entry.value())));
            } else {
                others.add(ir.extractCollectionElement(e));
            }
        }
        return new IrMapLiteralExpression(ir.nextId("map"), ir.locate(node), Map.of(), entries, others,
                typeArgument(node.typeArguments(), 0), typeArgument(node.typeArguments(), 1), node.isConst());
    }

    IrExpression collectionElement(CollectionElement element) {
        if (element instanceof Expression e) return ir.extractExpression(e);
        if (element instanceof SpreadElement spread) {
            IrExpression target = ir.extractExpression(spread.expression()).withMetadata(IS_SPREAD, true);
            return spread.nullAware() ? target.withMetadata(NULL_AWARE_SPREAD, true) : target;
        }
        if (element instanceof IfElement ifElement) return collectionIf(ifElement);
        if (element instanceof ForElement) {
            return new IrSkippedElementExpression(ir.nextId("skipped"), ir.locate(element), Map.of(),
                    SyntaxPrinter.print(element), "Collection for elements are not supported");
        }
        return ir.unknownExpression(element, "Map entry outside a map literal");
    }

    /** {@code [if (c) a else b]} becomes {@code c ? [a] : [b]}; a missing else is an empty list. */
    private IrExpression collectionIf(IfElement node) {
        IrExpression condition = condition(node.condition(), node.caseClause());
        IrExpression then = branchList(node.thenElement());
        IrExpression otherwise = branchList(node.elseElement());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(FROM_COLLECTION_IF, true);
        meta.put(THEN_IS_SPREAD, node.thenElement() instanceof SpreadElement);
        meta.put(ELSE_IS_SPREAD, node.elseElement() instanceof SpreadElement);
        return new IrConditionalExpression(ir.nextId("conditional"), ir.locate(node), meta, condition, then, otherwise);
    }

    private IrExpression branchList(CollectionElement branch) {
        List<IrExpression> elements = branch == null ? List.of() : List.of(ir.extractCollectionElement(branch));
        return new IrListLiteralExpression(ir.nextId("list"), ir.locate(branch), Map.of(FROM_COLLECTION_IF, true),
                elements, null, false);
    }

    /** Plain condition, or a pattern match when the construct is an if-case. */
    IrExpression condition(Expression condition, CaseClause caseClause) {
        IrExpression subject = ir.extractExpression(condition);
        if (caseClause == null) return subject;
        IrPattern pattern = ir.extractPattern(caseClause.guardedPattern().pattern());
        Expression when = caseClause.guardedPattern().whenClause();
        return new IrPatternMatchExpression(ir.nextId("patternMatch"), ir.locate(caseClause), Map.of(),
                subject, pattern, when == null ? null : ir.extractExpression(when));
    }

    // ---------------------------------------------------------------------------------------------
    // Closures
    // ---------------------------------------------------------------------------------------------

    @Override
    public IrExpression visitFunctionExpression(FunctionExpression node) {
        return lambda(node);
    }

    IrLambdaExpression lambda(FunctionExpression node) {
        List<IrParameter> params = new ArrayList<>();
        for (FormalParameter p : node.parameters().parameters()) {
            IrExpression defaultValue = p.defaultValue() == null ? null : ir.extractExpression(p.defaultValue());
            params.add(new IrParameter(p.name(), p.type(), parameterKind(p), defaultValue));
        }
        List<IrStatement> body = ir.extractBodyStatements(node.body());
        boolean arrow = node.body() instanceof ExpressionFunctionBody;
        boolean generator = node.body() instanceof BlockFunctionBody b && b.isGenerator();

        List<String> origins = new ArrayList<>();
        for (IrParameter p : params) origins.add(p.originTag());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(IS_ARROW, arrow);
        meta.put(STATEMENT_COUNT, body.size());
        meta.put(IS_ASYNC, node.body().isAsync());
        meta.put(IS_GENERATOR, generator);
        meta.put(PARAMETER_ORIGINS, origins);

        return new IrLambdaExpression(ir.nextId("lambda"), ir.locate(node), meta, params, body,
                node.body().isAsync(), generator, arrow, inferReturnType(node));
    }

    private static IrParameterKind parameterKind(FormalParameter p) {
        return switch (p.kind()) {
            case REQUIRED_POSITIONAL -> IrParameterKind.POSITIONAL;
            case OPTIONAL_POSITIONAL -> IrParameterKind.OPTIONAL_POSITIONAL;
            case NAMED -> p.isRequired() ? IrParameterKind.REQUIRED_NAMED : IrParameterKind.NAMED;
        };
    }

    static String inferReturnType(FunctionExpression node) {
        if (node.body() instanceof ExpressionFunctionBody arrow) {
            String literal = literalType(arrow.expression());
            return literal == null ? DYNAMIC : literal;
        }
        if (node.body() instanceof BlockFunctionBody && !ReturnedExpressions.of(node.body()).isEmpty()) return DYNAMIC;
        return IrLambdaExpression.UNTYPED;
    }

    private static String literalType(Expression e) {
        Expression x = e == null ? null : e.unparenthesized();
        if (x instanceof SimpleStringLiteral || x instanceof StringInterpolation) return "String";
        if (x instanceof IntegerLiteral) return "int";
        if (x instanceof DoubleLiteral) return "double";
        if (x instanceof BooleanLiteral) return "bool";
        if (x instanceof ListLiteral) return "List";
        if (x instanceof SetOrMapLiteral s) return s.isMap() ? "Map" : "Set";
        if (x instanceof NullLiteral) return "Null";
        return null;
    }

    // ---------------------------------------------------------------------------------------------
    // Misc
    // ---------------------------------------------------------------------------------------------

    @Override
    public IrExpression visitParenthesizedExpression(ParenthesizedExpression node) {
        return ir.extractExpression(node.unparenthesized());
    }

    @Override
    public IrExpression visitIsExpression(IsExpression node) {
        return new IrTypeCheckExpression(ir.nextId("is"), ir.locate(node), Map.of(),
                ir.extractExpression(node.expression()), node.type(), node.negated());
    }

    @Override
    public IrExpression visitAsExpression(AsExpression node) {
        return new IrCastExpression(ir.nextId("as"), ir.locate(node), Map.of(),
                ir.extractExpression(node.expression()), node.type());
    }

    @Override
    public IrExpression visitAwaitExpression(AwaitExpression node) {
        return new IrAwaitExpression(ir.nextId("await"), ir.locate(node), Map.of(), ir.extractExpression(node.expression()));
    }

    @Override
    public IrExpression visitThrowExpression(ThrowExpression node) {
        return new IrThrowExpression(ir.nextId("throw"), ir.locate(node), Map.of(), ir.extractExpression(node.expression()), false);
    }

    @Override
    public IrExpression visitRethrowExpression(RethrowExpression node) {
        return new IrThrowExpression(ir.nextId("throw"), ir.locate(node), Map.of(), null, true);
    }

    /** Only reached outside an argument list; the name is kept as metadata. */
    @Override
    public IrExpression visitNamedExpression(NamedExpression node) {
        return ir.extractExpression(node.expression()).withMetadata("argumentName", node.name());
    }

    @Override
    public IrExpression visitSwitchExpression(SwitchExpression node) {
        List<IrSwitchExpressionCase> cases = new ArrayList<>();
        for (SwitchExpressionCase c : node.cases()) {
            Expression when = c.guardedPattern().whenClause();
            cases.add(new IrSwitchExpressionCase(
                    ir.extractPattern(c.guardedPattern().pattern()),
                    when == null ? null : ir.extractExpression(when),
                    ir.extractExpression(c.expression())));
        }
        return new IrSwitchExpression(ir.nextId("switch"), ir.locate(node), Map.of(),
                ir.extractExpression(node.subject()), cases);
    }

    @Override
    public IrExpression visitOpaqueExpression(OpaqueExpression node) {
        return ir.unknownExpression(node, "Unsupported expression: " + node.nodeType());
    }

    // ---------------------------------------------------------------------------------------------
    // Patterns
    // ---------------------------------------------------------------------------------------------

    IrPattern pattern(PatternNode node) {
        if (node instanceof WildcardPattern w) {
            return new IrWildcardPattern(ir.nextId("pattern"), ir.locate(node), w.type());
        }
        if (node instanceof DeclaredVariablePattern v) {
            return new IrVariablePattern(ir.nextId("pattern", v.name()), ir.locate(node), v.name(), v.type(),
                    "final".equals(v.keyword()));
        }
        if (node instanceof ConstantPattern c) {
            return new IrConstantPattern(ir.nextId("pattern"), ir.locate(node), ir.extractExpression(c.expression()));
        }
        OpaquePattern o = (OpaquePattern) node;
        return new IrUnknownPattern(ir.nextId("pattern"), ir.locate(node), o.source(), "Unsupported pattern: " + o.nodeType());
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------

    private IrExpression literal(Expression node, Object value, IrLiteralKind kind) {
        return new IrLiteralExpression(ir.nextId("literal"), ir.locate(node), Map.of(), value, kind);
    }

    private List<IrExpression> elements(List<CollectionElement> elements) {
        List<IrExpression> out = new ArrayList<>();
        for (CollectionElement e : elements) {
            out.add(ir.extractCollectionElement(e));
        }
        return out;
    }

    List<IrExpression> positional(ArgumentList args) {
        List<IrExpression> out = new ArrayList<>();
        for (Expression a : args.positional()) {
            out.add(ir.extractExpression(a));
        }
        return out;
    }

    Map<String, IrExpression> named(ArgumentList args) {
        Map<String, IrExpression> out = new LinkedHashMap<>();
        for (NamedExpression a : args.named()) {
            out.put(a.name(), ir.extractExpression(a.expression()));
        }
        return out;
    }

    private static String typeArgument(List<String> typeArguments, int index) {
        return typeArguments.size() > index ? typeArguments.get(index) : null;
    }
}
