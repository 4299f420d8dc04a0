package info.isaksson.erland.widgettoir.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static factories for building syntax trees without source spans.
 *
 * <p>Adapters that have real offsets construct the records directly; these helpers are for
 * programmatic construction (synthesized nodes, fixtures).</p>
 */
public final class Syntax {

    private Syntax() {}

    public static IntegerLiteral integer(long value) {
        return new IntegerLiteral(Span.NONE, Long.toString(value), value);
    }

    public static DoubleLiteral decimal(double value) {
        return new DoubleLiteral(Span.NONE, Double.toString(value), value);
    }

    public static BooleanLiteral bool(boolean value) {
        return new BooleanLiteral(Span.NONE, value);
    }

    public static NullLiteral nullLiteral() {
        return new NullLiteral(Span.NONE);
    }

    /** Double-quoted string literal. */
    public static SimpleStringLiteral string(String value) {
        return new SimpleStringLiteral(Span.NONE, null, value);
    }

    public static StringInterpolation interpolation(InterpolationElement... elements) {
        return new StringInterpolation(Span.NONE, List.of(elements));
    }

    public static InterpolationString text(String value) {
        return new InterpolationString(Span.NONE, value);
    }

    public static InterpolationExpression embed(Expression expression) {
        boolean simple = expression instanceof SimpleIdentifier;
        return new InterpolationExpression(Span.NONE, expression, !simple);
    }

    public static SimpleIdentifier id(String name) {
        return new SimpleIdentifier(Span.NONE, name, null);
    }

    public static PrefixedIdentifier prefixed(String prefix, String name) {
        return new PrefixedIdentifier(Span.NONE, id(prefix), id(name));
    }

    public static BinaryExpression binary(Expression left, String operator, Expression right) {
        return new BinaryExpression(Span.NONE, left, operator, right);
    }

    public static PrefixExpression prefix(String operator, Expression operand) {
        return new PrefixExpression(Span.NONE, operator, operand);
    }

    public static PostfixExpression postfix(Expression operand, String operator) {
        return new PostfixExpression(Span.NONE, operand, operator);
    }

    public static AssignmentExpression assign(Expression left, String operator, Expression right) {
        return new AssignmentExpression(Span.NONE, left, operator, right);
    }

    public static ConditionalExpression ternary(Expression condition, Expression then, Expression otherwise) {
        return new ConditionalExpression(Span.NONE, condition, then, otherwise);
    }

    public static ArgumentList args(Expression... arguments) {
        return new ArgumentList(Span.NONE, List.of(arguments));
    }

    public static NamedExpression named(String name, Expression value) {
        return new NamedExpression(Span.NONE, name, value);
    }

    /** Implicit-keyword constructor call {@code Type(args)}. */
    public static InstanceCreationExpression create(String typeName, Expression... arguments) {
        return new InstanceCreationExpression(Span.NONE, null, typeName, List.of(), null, args(arguments));
    }

    public static InstanceCreationExpression createConst(String typeName, Expression... arguments) {
        return new InstanceCreationExpression(Span.NONE, "const", typeName, List.of(), null, args(arguments));
    }

    public static InstanceCreationExpression createNamed(String typeName, String constructorName, Expression... arguments) {
        return new InstanceCreationExpression(Span.NONE, null, typeName, List.of(), constructorName, args(arguments));
    }

    /** Unqualified call {@code name(args)}. */
    public static MethodInvocation call(String methodName, Expression... arguments) {
        return new MethodInvocation(Span.NONE, null, null, methodName, List.of(), args(arguments));
    }

    public static MethodInvocation call(Expression target, String methodName, Expression... arguments) {
        return new MethodInvocation(Span.NONE, target, ".", methodName, List.of(), args(arguments));
    }

    /** Cascade section {@code ..name(args)}. */
    public static MethodInvocation cascadeCall(String methodName, Expression... arguments) {
        return new MethodInvocation(Span.NONE, null, "..", methodName, List.of(), args(arguments));
    }

    public static PropertyAccess property(Expression target, String name) {
        return new PropertyAccess(Span.NONE, target, ".", name);
    }

    public static IndexExpression index(Expression target, Expression index) {
        return new IndexExpression(Span.NONE, target, false, index);
    }

    public static ListLiteral list(CollectionElement... elements) {
        return new ListLiteral(Span.NONE, false, List.of(), List.of(elements));
    }

    public static SetOrMapLiteral set(CollectionElement... elements) {
        return new SetOrMapLiteral(Span.NONE, false, List.of(), List.of(elements));
    }

    public static SetOrMapLiteral map(MapLiteralEntry... entries) {
        return new SetOrMapLiteral(Span.NONE, false, List.of(), List.of(entries));
    }

    public static MapLiteralEntry entry(Expression key, Expression value) {
        return new MapLiteralEntry(Span.NONE, key, value);
    }

    public static SpreadElement spread(Expression expression) {
        return new SpreadElement(Span.NONE, expression, false);
    }

    public static SpreadElement nullAwareSpread(Expression expression) {
        return new SpreadElement(Span.NONE, expression, true);
    }

    public static IfElement ifElement(Expression condition, CollectionElement then) {
        return new IfElement(Span.NONE, condition, null, then, null);
    }

    public static IfElement ifElement(Expression condition, CollectionElement then, CollectionElement otherwise) {
        return new IfElement(Span.NONE, condition, null, then, otherwise);
    }

    /** {@code for (final variable in iterable) body}. */
    public static ForElement forIn(String variable, Expression iterable, CollectionElement body) {
        return new ForElement(Span.NONE, false, forEachParts(variable, iterable), body);
    }

    public static ForEachPartsWithDeclaration forEachParts(String variable, Expression iterable) {
        return new ForEachPartsWithDeclaration(Span.NONE, new DeclaredIdentifier(Span.NONE, "final", null, variable), iterable);
    }

    public static CascadeExpression cascade(Expression target, Expression... sections) {
        return new CascadeExpression(Span.NONE, target, List.of(sections), false);
    }

    public static FormalParameter param(String name) {
        return new FormalParameter(Span.NONE, name, null, FormalParameter.Kind.REQUIRED_POSITIONAL, true, null);
    }

    public static FormalParameter param(String name, String type) {
        return new FormalParameter(Span.NONE, name, type, FormalParameter.Kind.REQUIRED_POSITIONAL, true, null);
    }

    public static FormalParameterList params(String... names) {
        List<FormalParameter> out = new ArrayList<>();
        for (String n : names) out.add(param(n));
        return new FormalParameterList(Span.NONE, out);
    }

    public static FormalParameterList paramList(FormalParameter... parameters) {
        return new FormalParameterList(Span.NONE, Arrays.asList(parameters));
    }

    /** {@code (params) => body}. */
    public static FunctionExpression arrow(FormalParameterList parameters, Expression body) {
        return new FunctionExpression(Span.NONE, List.of(), parameters, new ExpressionFunctionBody(Span.NONE, body, false));
    }

    public static FunctionExpression asyncArrow(FormalParameterList parameters, Expression body) {
        return new FunctionExpression(Span.NONE, List.of(), parameters, new ExpressionFunctionBody(Span.NONE, body, true));
    }

    /** {@code (params) { statements }}. */
    public static FunctionExpression closure(FormalParameterList parameters, Statement... statements) {
        return new FunctionExpression(Span.NONE, List.of(), parameters,
                new BlockFunctionBody(Span.NONE, block(statements), false, false));
    }

    public static FunctionExpression asyncClosure(FormalParameterList parameters, Statement... statements) {
        return new FunctionExpression(Span.NONE, List.of(), parameters,
                new BlockFunctionBody(Span.NONE, block(statements), true, false));
    }

    public static ParenthesizedExpression paren(Expression expression) {
        return new ParenthesizedExpression(Span.NONE, expression);
    }

    public static Block block(Statement... statements) {
        return new Block(Span.NONE, List.of(statements));
    }

    public static ExpressionStatement stmt(Expression expression) {
        return new ExpressionStatement(Span.NONE, expression);
    }

    public static ReturnStatement ret(Expression expression) {
        return new ReturnStatement(Span.NONE, expression);
    }

    /** {@code final name = initializer;} */
    public static VariableDeclarationStatement declare(String name, Expression initializer) {
        return new VariableDeclarationStatement(Span.NONE, new VariableDeclarationList(Span.NONE, "final", false, null,
                List.of(new VariableDeclaration(Span.NONE, name, initializer))));
    }

    public static IfStatement ifStatement(Expression condition, Statement then, Statement otherwise) {
        return new IfStatement(Span.NONE, condition, null, then, otherwise);
    }

    public static ForStatement forInStatement(String variable, Expression iterable, Statement body) {
        return new ForStatement(Span.NONE, false, forEachParts(variable, iterable), body);
    }

    public static WhileStatement whileStatement(Expression condition, Statement body) {
        return new WhileStatement(Span.NONE, condition, body);
    }

    public static BlockFunctionBody blockBody(Statement... statements) {
        return new BlockFunctionBody(Span.NONE, block(statements), false, false);
    }

    public static ExpressionFunctionBody arrowBody(Expression expression) {
        return new ExpressionFunctionBody(Span.NONE, expression, false);
    }

    public static OpaqueExpression opaque(String nodeType, String source) {
        return new OpaqueExpression(Span.NONE, nodeType, source);
    }
}
