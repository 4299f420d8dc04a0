package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.ir.WidgetConventions;
import info.isaksson.erland.widgettoir.ir.expr.IrBinaryOperator;
import info.isaksson.erland.widgettoir.ir.stmt.IrExpressionKind;
import info.isaksson.erland.widgettoir.syntax.AsExpression;
import info.isaksson.erland.widgettoir.syntax.AssignmentExpression;
import info.isaksson.erland.widgettoir.syntax.AwaitExpression;
import info.isaksson.erland.widgettoir.syntax.BinaryExpression;
import info.isaksson.erland.widgettoir.syntax.BooleanLiteral;
import info.isaksson.erland.widgettoir.syntax.CascadeExpression;
import info.isaksson.erland.widgettoir.syntax.ConditionalExpression;
import info.isaksson.erland.widgettoir.syntax.DoubleLiteral;
import info.isaksson.erland.widgettoir.syntax.ExpressionVisitor;
import info.isaksson.erland.widgettoir.syntax.FunctionExpression;
import info.isaksson.erland.widgettoir.syntax.FunctionExpressionInvocation;
import info.isaksson.erland.widgettoir.syntax.IndexExpression;
import info.isaksson.erland.widgettoir.syntax.InstanceCreationExpression;
import info.isaksson.erland.widgettoir.syntax.IntegerLiteral;
import info.isaksson.erland.widgettoir.syntax.IsExpression;
import info.isaksson.erland.widgettoir.syntax.ListLiteral;
import info.isaksson.erland.widgettoir.syntax.MethodInvocation;
import info.isaksson.erland.widgettoir.syntax.NamedExpression;
import info.isaksson.erland.widgettoir.syntax.NullLiteral;
import info.isaksson.erland.widgettoir.syntax.OpaqueExpression;
import info.isaksson.erland.widgettoir.syntax.ParenthesizedExpression;
import info.isaksson.erland.widgettoir.syntax.PostfixExpression;
import info.isaksson.erland.widgettoir.syntax.PrefixExpression;
import info.isaksson.erland.widgettoir.syntax.PrefixedIdentifier;
import info.isaksson.erland.widgettoir.syntax.PropertyAccess;
import info.isaksson.erland.widgettoir.syntax.RethrowExpression;
import info.isaksson.erland.widgettoir.syntax.SetOrMapLiteral;
import info.isaksson.erland.widgettoir.syntax.SimpleIdentifier;
import info.isaksson.erland.widgettoir.syntax.SimpleStringLiteral;
import info.isaksson.erland.widgettoir.syntax.StringInterpolation;
import info.isaksson.erland.widgettoir.syntax.SuperExpression;
import info.isaksson.erland.widgettoir.syntax.SwitchExpression;
import info.isaksson.erland.widgettoir.syntax.ThisExpression;
import info.isaksson.erland.widgettoir.syntax.ThrowExpression;

import java.util.Locale;

/**
 * Tags the expression of an expression statement with an {@link IrExpressionKind}.
 * Method-name rules are checked in order; the first match wins.
 */
final class ExpressionStatementClassifier implements ExpressionVisitor<IrExpressionKind> {

    @Override
    public IrExpressionKind visitMethodInvocation(MethodInvocation node) {
        String name = node.methodName() == null ? "" : node.methodName().toLowerCase(Locale.ROOT);
        if (name.equals(WidgetConventions.RUN_APP.toLowerCase(Locale.ROOT))) return IrExpressionKind.FRAMEWORK_INITIALIZATION;
        if (name.startsWith("set")) return IrExpressionKind.SETTER_CALL;
        if (name.startsWith("get")) return IrExpressionKind.GETTER_CALL;
        if (name.equals("print")) return IrExpressionKind.DEBUG_CALL;
        if (name.equals("tostring")) return IrExpressionKind.CONVERSION_CALL;
        if (name.contains("validate")) return IrExpressionKind.VALIDATION_CALL;
        if (name.contains("build")) return IrExpressionKind.BUILD_CALL;
        if (name.contains("create")) return IrExpressionKind.FACTORY_CALL;
        if (name.contains("init")) return IrExpressionKind.INITIALIZATION_CALL;
        return IrExpressionKind.METHOD_CALL;
    }

    @Override
    public IrExpressionKind visitFunctionExpressionInvocation(FunctionExpressionInvocation node) {
        return IrExpressionKind.METHOD_CALL;
    }

    @Override
    public IrExpressionKind visitInstanceCreationExpression(InstanceCreationExpression node) {
        String type = node.typeName() == null ? "" : node.typeName();
        if (type.equals("Future")) return IrExpressionKind.ASYNC_CONSTRUCTION;
        if (type.equals("Stream")) return IrExpressionKind.STREAM_CONSTRUCTION;
        if (type.startsWith(WidgetConventions.STATE_HOLDER_TYPE)) return IrExpressionKind.STATE_CONSTRUCTION;
        if (type.endsWith("Exception") || type.endsWith("Error")) return IrExpressionKind.ERROR_CONSTRUCTION;
        return IrExpressionKind.OBJECT_CONSTRUCTION;
    }

    @Override
    public IrExpressionKind visitBinaryExpression(BinaryExpression node) {
        IrBinaryOperator op = IrBinaryOperator.fromLexeme(node.operator());
        if (op == null) return IrExpressionKind.UNKNOWN_EXPRESSION;
        return switch (op.category) {
            case ARITHMETIC -> IrExpressionKind.ARITHMETIC;
            case COMPARISON -> IrExpressionKind.COMPARISON;
            case LOGICAL -> IrExpressionKind.LOGICAL;
            case BITWISE -> IrExpressionKind.BITWISE;
            case NULL_COALESCE -> IrExpressionKind.NULL_COALESCE;
        };
    }

    @Override
    public IrExpressionKind visitPrefixExpression(PrefixExpression node) {
        return unary(node.operator());
    }

    @Override
    public IrExpressionKind visitPostfixExpression(PostfixExpression node) {
        return unary(node.operator());
    }

    private static IrExpressionKind unary(String operator) {
        String op = operator == null ? "" : operator.trim();
        switch (op) {
            case "!":
                return IrExpressionKind.LOGICAL_NEGATION;
            case "+":
            case "-":
                return IrExpressionKind.ARITHMETIC_SIGN;
            case "++":
            case "--":
                return IrExpressionKind.INCREMENT_DECREMENT;
            case "~":
                return IrExpressionKind.BITWISE_NOT;
            default:
                return IrExpressionKind.UNKNOWN_EXPRESSION;
        }
    }

    @Override
    public IrExpressionKind visitIntegerLiteral(IntegerLiteral node) {
        return IrExpressionKind.INTEGER_LITERAL;
    }

    @Override
    public IrExpressionKind visitDoubleLiteral(DoubleLiteral node) {
        return IrExpressionKind.DOUBLE_LITERAL;
    }

    @Override
    public IrExpressionKind visitBooleanLiteral(BooleanLiteral node) {
        return IrExpressionKind.BOOLEAN_LITERAL;
    }

    @Override
    public IrExpressionKind visitNullLiteral(NullLiteral node) {
        return IrExpressionKind.NULL_LITERAL;
    }

    @Override
    public IrExpressionKind visitSimpleStringLiteral(SimpleStringLiteral node) {
        return IrExpressionKind.STRING_LITERAL;
    }

    @Override
    public IrExpressionKind visitStringInterpolation(StringInterpolation node) {
        return IrExpressionKind.STRING_LITERAL;
    }

    @Override
    public IrExpressionKind visitListLiteral(ListLiteral node) {
        return IrExpressionKind.LIST_LITERAL;
    }

    @Override
    public IrExpressionKind visitSetOrMapLiteral(SetOrMapLiteral node) {
        return IrExpressionKind.MAP_OR_SET_LITERAL;
    }

    /** Capitalized names are taken to be constants or type references. */
    @Override
    public IrExpressionKind visitSimpleIdentifier(SimpleIdentifier node) {
        String name = node.name();
        if (name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0))) {
            return IrExpressionKind.CONSTANT_REFERENCE;
        }
        return IrExpressionKind.VARIABLE_REFERENCE;
    }

    @Override
    public IrExpressionKind visitPrefixedIdentifier(PrefixedIdentifier node) {
        return IrExpressionKind.VARIABLE_REFERENCE;
    }

    @Override
    public IrExpressionKind visitPropertyAccess(PropertyAccess node) {
        return IrExpressionKind.VARIABLE_REFERENCE;
    }

    @Override
    public IrExpressionKind visitIndexExpression(IndexExpression node) {
        return IrExpressionKind.VARIABLE_REFERENCE;
    }

    @Override
    public IrExpressionKind visitThisExpression(ThisExpression node) {
        return IrExpressionKind.SELF_REFERENCE;
    }

    @Override
    public IrExpressionKind visitSuperExpression(SuperExpression node) {
        return IrExpressionKind.SUPER_REFERENCE;
    }

    @Override
    public IrExpressionKind visitConditionalExpression(ConditionalExpression node) {
        return IrExpressionKind.TERNARY_CONDITIONAL;
    }

    @Override
    public IrExpressionKind visitAssignmentExpression(AssignmentExpression node) {
        return IrExpressionKind.ASSIGNMENT;
    }

    @Override
    public IrExpressionKind visitIsExpression(IsExpression node) {
        return IrExpressionKind.TYPE_CHECK;
    }

    @Override
    public IrExpressionKind visitAsExpression(AsExpression node) {
        return IrExpressionKind.TYPE_CAST;
    }

    @Override
    public IrExpressionKind visitCascadeExpression(CascadeExpression node) {
        return IrExpressionKind.CASCADE_CHAIN;
    }

    @Override
    public IrExpressionKind visitFunctionExpression(FunctionExpression node) {
        return IrExpressionKind.LAMBDA_FUNCTION;
    }

    @Override
    public IrExpressionKind visitAwaitExpression(AwaitExpression node) {
        return IrExpressionKind.AWAIT_EXPRESSION;
    }

    @Override
    public IrExpressionKind visitThrowExpression(ThrowExpression node) {
        return IrExpressionKind.THROW_EXPRESSION;
    }

    @Override
    public IrExpressionKind visitRethrowExpression(RethrowExpression node) {
        return IrExpressionKind.THROW_EXPRESSION;
    }

    @Override
    public IrExpressionKind visitParenthesizedExpression(ParenthesizedExpression node) {
        return node.unparenthesized().accept(this);
    }

    @Override
    public IrExpressionKind visitNamedExpression(NamedExpression node) {
        return node.expression() == null ? IrExpressionKind.UNKNOWN_EXPRESSION : node.expression().accept(this);
    }

    @Override
    public IrExpressionKind visitSwitchExpression(SwitchExpression node) {
        return IrExpressionKind.UNKNOWN_EXPRESSION;
    }

    @Override
    public IrExpressionKind visitOpaqueExpression(OpaqueExpression node) {
        return IrExpressionKind.UNKNOWN_EXPRESSION;
    }
}
