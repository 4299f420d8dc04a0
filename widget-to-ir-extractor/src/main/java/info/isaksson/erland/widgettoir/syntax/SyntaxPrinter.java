package info.isaksson.erland.widgettoir.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders syntax nodes back to canonical single-line source text.
 *
 * <p>Used wherever a component or IR node records source text (conditions, iterables, property
 * values, unknown nodes). The rendering is stable: the same tree always prints the same string.</p>
 */
public final class SyntaxPrinter {

    private static final Printer PRINTER = new Printer();

    private SyntaxPrinter() {}

    public static String print(SyntaxNode node) {
        if (node == null) return "";
        if (node instanceof Expression) return ((Expression) node).accept(PRINTER);
        if (node instanceof Statement) return ((Statement) node).accept(PRINTER);
        if (node instanceof SpreadElement) {
            SpreadElement s = (SpreadElement) node;
            return (s.nullAware() ? "...?" : "...") + print(s.expression());
        }
        if (node instanceof IfElement) {
            IfElement e = (IfElement) node;
            String out = "if (" + print(e.condition()) + caseSuffix(e.caseClause()) + ") " + print(e.thenElement());
            return e.elseElement() == null ? out : out + " else " + print(e.elseElement());
        }
        if (node instanceof ForElement) {
            ForElement f = (ForElement) node;
            return (f.isAwait() ? "await " : "") + "for (" + print(f.parts()) + ") " + print(f.body());
        }
        if (node instanceof MapLiteralEntry) {
            MapLiteralEntry e = (MapLiteralEntry) node;
            return print(e.key()) + ": " + print(e.value());
        }
        if (node instanceof InterpolationString) return ((InterpolationString) node).value();
        if (node instanceof InterpolationExpression) {
            InterpolationExpression e = (InterpolationExpression) node;
            return e.braced() ? "${" + print(e.expression()) + "}" : "$" + print(e.expression());
        }
        if (node instanceof ArgumentList) return "(" + joinArguments(((ArgumentList) node).arguments()) + ")";
        if (node instanceof FormalParameterList) return formalParameters((FormalParameterList) node);
        if (node instanceof FormalParameter) return formalParameter((FormalParameter) node);
        if (node instanceof BlockFunctionBody) {
            BlockFunctionBody b = (BlockFunctionBody) node;
            return asyncPrefix(b.isAsync(), b.isGenerator()) + print(b.block());
        }
        if (node instanceof ExpressionFunctionBody) {
            ExpressionFunctionBody b = (ExpressionFunctionBody) node;
            return (b.isAsync() ? "async " : "") + "=> " + print(b.expression());
        }
        if (node instanceof EmptyFunctionBody) return ";";
        if (node instanceof VariableDeclarationList) return variableList((VariableDeclarationList) node);
        if (node instanceof VariableDeclaration) {
            VariableDeclaration v = (VariableDeclaration) node;
            return v.initializer() == null ? v.name() : v.name() + " = " + print(v.initializer());
        }
        if (node instanceof DeclaredIdentifier) {
            DeclaredIdentifier d = (DeclaredIdentifier) node;
            return words(d.keyword(), d.type(), d.name());
        }
        if (node instanceof ForPartsWithDeclarations) {
            ForPartsWithDeclarations p = (ForPartsWithDeclarations) node;
            return forParts(print(p.variables()), p.condition(), p.updaters());
        }
        if (node instanceof ForPartsWithExpressions) {
            ForPartsWithExpressions p = (ForPartsWithExpressions) node;
            return forParts(print(p.initialization()), p.condition(), p.updaters());
        }
        if (node instanceof ForEachPartsWithDeclaration) {
            ForEachPartsWithDeclaration p = (ForEachPartsWithDeclaration) node;
            return print(p.loopVariable()) + " in " + print(p.iterable());
        }
        if (node instanceof ForEachPartsWithIdentifier) {
            ForEachPartsWithIdentifier p = (ForEachPartsWithIdentifier) node;
            return print(p.identifier()) + " in " + print(p.iterable());
        }
        if (node instanceof CatchClause) return catchClause((CatchClause) node);
        if (node instanceof SwitchMember) return switchMember((SwitchMember) node);
        if (node instanceof CaseClause) return "case " + print(((CaseClause) node).guardedPattern());
        if (node instanceof GuardedPattern) {
            GuardedPattern g = (GuardedPattern) node;
            return g.whenClause() == null ? print(g.pattern()) : print(g.pattern()) + " when " + print(g.whenClause());
        }
        if (node instanceof SwitchExpressionCase) {
            SwitchExpressionCase c = (SwitchExpressionCase) node;
            return print(c.guardedPattern()) + " => " + print(c.expression());
        }
        if (node instanceof WildcardPattern) return words(((WildcardPattern) node).type(), "_");
        if (node instanceof DeclaredVariablePattern) {
            DeclaredVariablePattern p = (DeclaredVariablePattern) node;
            return words(p.keyword(), p.type(), p.name());
        }
        if (node instanceof ConstantPattern) return print(((ConstantPattern) node).expression());
        if (node instanceof OpaquePattern) return nullToEmpty(((OpaquePattern) node).source());
        if (node instanceof FieldInitializer) {
            FieldInitializer f = (FieldInitializer) node;
            return f.fieldName() + " = " + print(f.expression());
        }
        if (node instanceof SuperConstructorInvocation) {
            SuperConstructorInvocation s = (SuperConstructorInvocation) node;
            return "super" + dotted(s.constructorName()) + print(s.arguments());
        }
        if (node instanceof RedirectingConstructorInvocation) {
            RedirectingConstructorInvocation r = (RedirectingConstructorInvocation) node;
            return "this" + dotted(r.constructorName()) + print(r.arguments());
        }
        if (node instanceof AssertInitializer) {
            AssertInitializer a = (AssertInitializer) node;
            return "assert(" + print(a.condition()) + (a.message() == null ? "" : ", " + print(a.message())) + ")";
        }
        if (node instanceof Declaration) return declaration((Declaration) node);
        if (node instanceof CompilationUnit) {
            return ((CompilationUnit) node).declarations().stream().map(SyntaxPrinter::print).collect(Collectors.joining("\n"));
        }
        return node.nodeType();
    }

    private static String declaration(Declaration d) {
        if (d instanceof ClassDeclaration) {
            ClassDeclaration c = (ClassDeclaration) d;
            String head = "class " + c.name() + (c.superclass() == null ? "" : " extends " + c.superclass());
            return head + " { " + c.members().stream().map(SyntaxPrinter::print).collect(Collectors.joining(" ")) + " }";
        }
        if (d instanceof MethodDeclaration) {
            MethodDeclaration m = (MethodDeclaration) d;
            String params = m.isGetter() ? "" : print(m.parameters());
            return words(m.isStatic() ? "static" : null, m.returnType(), m.propertyKeyword(), m.name()) + params + " " + print(m.body());
        }
        if (d instanceof ConstructorDeclaration) {
            ConstructorDeclaration c = (ConstructorDeclaration) d;
            String head = words(c.isConst() ? "const" : null, c.isFactory() ? "factory" : null, c.name()) + print(c.parameters());
            if (c.redirectedConstructor() != null) return head + " = " + c.redirectedConstructor() + ";";
            if (!c.initializers().isEmpty()) {
                head += " : " + c.initializers().stream().map(SyntaxPrinter::print).collect(Collectors.joining(", "));
            }
            return c.body() instanceof EmptyFunctionBody ? head + ";" : head + " " + print(c.body());
        }
        if (d instanceof FieldDeclaration) {
            FieldDeclaration f = (FieldDeclaration) d;
            return (f.isStatic() ? "static " : "") + print(f.fields()) + ";";
        }
        if (d instanceof TopLevelVariableDeclaration) {
            return print(((TopLevelVariableDeclaration) d).variables()) + ";";
        }
        FunctionDeclaration f = (FunctionDeclaration) d;
        return functionDeclaration(f);
    }

    private static String functionDeclaration(FunctionDeclaration f) {
        FunctionExpression fn = f.function();
        String params = fn == null || "get".equals(f.propertyKeyword()) ? "" : print(fn.parameters());
        String body = fn == null ? ";" : print(fn.body());
        return words(f.returnType(), f.propertyKeyword(), f.name()) + params + " " + body;
    }

    private static String forParts(String init, Expression condition, List<Expression> updaters) {
        return init + "; " + print(condition) + "; " + updaters.stream().map(SyntaxPrinter::print).collect(Collectors.joining(", "));
    }

    private static String variableList(VariableDeclarationList v) {
        String head = words(v.isLate() ? "late" : null, v.keyword(), v.type());
        String vars = v.variables().stream().map(SyntaxPrinter::print).collect(Collectors.joining(", "));
        return head.isEmpty() ? vars : head + " " + vars;
    }

    private static String catchClause(CatchClause c) {
        StringBuilder sb = new StringBuilder();
        if (c.exceptionType() != null) sb.append("on ").append(c.exceptionType()).append(' ');
        if (c.exceptionParameter() != null) {
            sb.append("catch (").append(c.exceptionParameter());
            if (c.stackTraceParameter() != null) sb.append(", ").append(c.stackTraceParameter());
            sb.append(") ");
        }
        return sb.append(print(c.body())).toString();
    }

    private static String switchMember(SwitchMember m) {
        StringBuilder sb = new StringBuilder();
        for (String label : m.labels()) sb.append(label).append(": ");
        if (m instanceof SwitchCase) {
            sb.append("case ").append(print(((SwitchCase) m).expression())).append(':');
        } else if (m instanceof SwitchPatternCase) {
            sb.append("case ").append(print(((SwitchPatternCase) m).guardedPattern())).append(':');
        } else {
            sb.append("default:");
        }
        for (Statement s : m.statements()) sb.append(' ').append(print(s));
        return sb.toString();
    }

    private static String formalParameters(FormalParameterList list) {
        List<String> required = new ArrayList<>();
        List<String> optional = new ArrayList<>();
        List<String> named = new ArrayList<>();
        for (FormalParameter p : list.parameters()) {
            switch (p.kind()) {
                case OPTIONAL_POSITIONAL -> optional.add(formalParameter(p));
                case NAMED -> named.add(formalParameter(p));
                default -> required.add(formalParameter(p));
            }
        }
        List<String> groups = new ArrayList<>(required);
        if (!optional.isEmpty()) groups.add("[" + String.join(", ", optional) + "]");
        if (!named.isEmpty()) groups.add("{" + String.join(", ", named) + "}");
        return "(" + String.join(", ", groups) + ")";
    }

    private static String formalParameter(FormalParameter p) {
        String s = words(p.isRequired() && p.kind() == FormalParameter.Kind.NAMED ? "required" : null, p.type(), p.name());
        return p.defaultValue() == null ? s : s + " = " + print(p.defaultValue());
    }

    private static String caseSuffix(CaseClause c) {
        return c == null ? "" : " " + print(c);
    }

    private static String asyncPrefix(boolean async, boolean generator) {
        if (async) return generator ? "async* " : "async ";
        return generator ? "sync* " : "";
    }

    private static String typeArguments(List<String> args) {
        return args.isEmpty() ? "" : "<" + String.join(", ", args) + ">";
    }

    private static String joinArguments(List<Expression> args) {
        return args.stream().map(SyntaxPrinter::print).collect(Collectors.joining(", "));
    }

    private static String joinElements(List<CollectionElement> elements) {
        return elements.stream().map(SyntaxPrinter::print).collect(Collectors.joining(", "));
    }

    private static String dotted(String name) {
        return name == null || name.isEmpty() ? "" : "." + name;
    }

    private static String words(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p == null || p.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(p);
        }
        return sb.toString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String target(Expression target, String operator) {
        if (target == null) return operator == null || !operator.endsWith("..") ? "" : operator;
        return print(target) + (operator == null ? "." : operator);
    }

    private static final class Printer implements ExpressionVisitor<String>, StatementVisitor<String> {

        @Override public String visitIntegerLiteral(IntegerLiteral node) {
            return node.lexeme() != null ? node.lexeme() : Long.toString(node.value());
        }

        @Override public String visitDoubleLiteral(DoubleLiteral node) {
            return node.lexeme() != null ? node.lexeme() : Double.toString(node.value());
        }

        @Override public String visitBooleanLiteral(BooleanLiteral node) {
            return Boolean.toString(node.value());
        }

        @Override public String visitNullLiteral(NullLiteral node) {
            return "null";
        }

        @Override public String visitSimpleStringLiteral(SimpleStringLiteral node) {
            if (node.lexeme() != null) return node.lexeme();
            return "\"" + nullToEmpty(node.value()).replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }

        @Override public String visitStringInterpolation(StringInterpolation node) {
            StringBuilder sb = new StringBuilder("\"");
            for (InterpolationElement e : node.elements()) sb.append(print(e));
            return sb.append('"').toString();
        }

        @Override public String visitSimpleIdentifier(SimpleIdentifier node) {
            return nullToEmpty(node.name());
        }

        @Override public String visitPrefixedIdentifier(PrefixedIdentifier node) {
            return print(node.prefix()) + "." + print(node.identifier());
        }

        @Override public String visitThisExpression(ThisExpression node) {
            return "this";
        }

        @Override public String visitSuperExpression(SuperExpression node) {
            return "super";
        }

        @Override public String visitBinaryExpression(BinaryExpression node) {
            return print(node.left()) + " " + node.operator() + " " + print(node.right());
        }

        @Override public String visitPrefixExpression(PrefixExpression node) {
            return node.operator() + print(node.operand());
        }

        @Override public String visitPostfixExpression(PostfixExpression node) {
            return print(node.operand()) + node.operator();
        }

        @Override public String visitAssignmentExpression(AssignmentExpression node) {
            return print(node.left()) + " " + node.operator() + " " + print(node.right());
        }

        @Override public String visitConditionalExpression(ConditionalExpression node) {
            return print(node.condition()) + " ? " + print(node.thenExpression()) + " : " + print(node.elseExpression());
        }

        @Override public String visitMethodInvocation(MethodInvocation node) {
            return target(node.target(), node.operator()) + node.methodName() + typeArguments(node.typeArguments())
                    + print(node.arguments());
        }

        @Override public String visitFunctionExpressionInvocation(FunctionExpressionInvocation node) {
            return print(node.function()) + typeArguments(node.typeArguments()) + print(node.arguments());
        }

        @Override public String visitInstanceCreationExpression(InstanceCreationExpression node) {
            String keyword = node.keyword() == null ? "" : node.keyword() + " ";
            return keyword + node.typeName() + typeArguments(node.typeArguments()) + dotted(node.constructorName())
                    + print(node.arguments());
        }

        @Override public String visitPropertyAccess(PropertyAccess node) {
            return target(node.target(), node.operator()) + node.propertyName();
        }

        @Override public String visitIndexExpression(IndexExpression node) {
            return print(node.target()) + (node.nullAware() ? "?[" : "[") + print(node.index()) + "]";
        }

        @Override public String visitListLiteral(ListLiteral node) {
            return (node.isConst() ? "const " : "") + typeArguments(node.typeArguments()) + "[" + joinElements(node.elements()) + "]";
        }

        @Override public String visitSetOrMapLiteral(SetOrMapLiteral node) {
            return (node.isConst() ? "const " : "") + typeArguments(node.typeArguments()) + "{" + joinElements(node.elements()) + "}";
        }

        @Override public String visitCascadeExpression(CascadeExpression node) {
            StringBuilder sb = new StringBuilder(print(node.target()));
            for (Expression section : node.sections()) sb.append(print(section));
            return sb.toString();
        }

        @Override public String visitFunctionExpression(FunctionExpression node) {
            return typeArguments(node.typeParameters()) + print(node.parameters()) + " " + print(node.body());
        }

        @Override public String visitParenthesizedExpression(ParenthesizedExpression node) {
            return "(" + print(node.expression()) + ")";
        }

        @Override public String visitIsExpression(IsExpression node) {
            return print(node.expression()) + (node.negated() ? " is! " : " is ") + node.type();
        }

        @Override public String visitAsExpression(AsExpression node) {
            return print(node.expression()) + " as " + node.type();
        }

        @Override public String visitAwaitExpression(AwaitExpression node) {
            return "await " + print(node.expression());
        }

        @Override public String visitThrowExpression(ThrowExpression node) {
            return "throw " + print(node.expression());
        }

        @Override public String visitRethrowExpression(RethrowExpression node) {
            return "rethrow";
        }

        @Override public String visitNamedExpression(NamedExpression node) {
            return node.name() + ": " + print(node.expression());
        }

        @Override public String visitSwitchExpression(SwitchExpression node) {
            return "switch (" + print(node.subject()) + ") { "
                    + node.cases().stream().map(SyntaxPrinter::print).collect(Collectors.joining(", ")) + " }";
        }

        @Override public String visitOpaqueExpression(OpaqueExpression node) {
            return nullToEmpty(node.source());
        }

        @Override public String visitBlock(Block node) {
            if (node.statements().isEmpty()) return "{}";
            return "{ " + node.statements().stream().map(SyntaxPrinter::print).collect(Collectors.joining(" ")) + " }";
        }

        @Override public String visitVariableDeclarationStatement(VariableDeclarationStatement node) {
            return print(node.variables()) + ";";
        }

        @Override public String visitExpressionStatement(ExpressionStatement node) {
            return print(node.expression()) + ";";
        }

        @Override public String visitReturnStatement(ReturnStatement node) {
            return node.expression() == null ? "return;" : "return " + print(node.expression()) + ";";
        }

        @Override public String visitIfStatement(IfStatement node) {
            String out = "if (" + print(node.condition()) + caseSuffix(node.caseClause()) + ") " + print(node.thenStatement());
            return node.elseStatement() == null ? out : out + " else " + print(node.elseStatement());
        }

        @Override public String visitForStatement(ForStatement node) {
            return (node.isAwait() ? "await " : "") + "for (" + print(node.parts()) + ") " + print(node.body());
        }

        @Override public String visitWhileStatement(WhileStatement node) {
            return "while (" + print(node.condition()) + ") " + print(node.body());
        }

        @Override public String visitDoStatement(DoStatement node) {
            return "do " + print(node.body()) + " while (" + print(node.condition()) + ");";
        }

        @Override public String visitTryStatement(TryStatement node) {
            StringBuilder sb = new StringBuilder("try ").append(print(node.body()));
            for (CatchClause c : node.catchClauses()) sb.append(' ').append(print(c));
            if (node.finallyBlock() != null) sb.append(" finally ").append(print(node.finallyBlock()));
            return sb.toString();
        }

        @Override public String visitSwitchStatement(SwitchStatement node) {
            return "switch (" + print(node.expression()) + ") { "
                    + node.members().stream().map(SyntaxPrinter::print).collect(Collectors.joining(" ")) + " }";
        }

        @Override public String visitBreakStatement(BreakStatement node) {
            return node.label() == null ? "break;" : "break " + node.label() + ";";
        }

        @Override public String visitContinueStatement(ContinueStatement node) {
            return node.label() == null ? "continue;" : "continue " + node.label() + ";";
        }

        @Override public String visitAssertStatement(AssertStatement node) {
            return "assert(" + print(node.condition()) + (node.message() == null ? "" : ", " + print(node.message())) + ");";
        }

        @Override public String visitLabeledStatement(LabeledStatement node) {
            StringBuilder sb = new StringBuilder();
            for (String label : node.labels()) sb.append(label).append(": ");
            return sb.append(print(node.statement())).toString();
        }

        @Override public String visitYieldStatement(YieldStatement node) {
            return (node.star() ? "yield* " : "yield ") + print(node.expression()) + ";";
        }

        @Override public String visitFunctionDeclarationStatement(FunctionDeclarationStatement node) {
            return node.function() == null ? "" : functionDeclaration(node.function());
        }

        @Override public String visitEmptyStatement(EmptyStatement node) {
            return ";";
        }

        @Override public String visitOpaqueStatement(OpaqueStatement node) {
            return nullToEmpty(node.source());
        }
    }
}
