package info.isaksson.erland.widgettoir.detect;

import info.isaksson.erland.widgettoir.component.CollectionComponent;
import info.isaksson.erland.widgettoir.component.LoopComponent;
import info.isaksson.erland.widgettoir.component.PropertyBinding;
import info.isaksson.erland.widgettoir.ir.WidgetConventions;
import info.isaksson.erland.widgettoir.syntax.CollectionElement;
import info.isaksson.erland.widgettoir.syntax.ConditionalExpression;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.ForEachParts;
import info.isaksson.erland.widgettoir.syntax.ForElement;
import info.isaksson.erland.widgettoir.syntax.ForLoopParts;
import info.isaksson.erland.widgettoir.syntax.ForParts;
import info.isaksson.erland.widgettoir.syntax.ForStatement;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclaration;
import info.isaksson.erland.widgettoir.syntax.FunctionDeclarationStatement;
import info.isaksson.erland.widgettoir.syntax.FunctionExpression;
import info.isaksson.erland.widgettoir.syntax.IfElement;
import info.isaksson.erland.widgettoir.syntax.IfStatement;
import info.isaksson.erland.widgettoir.syntax.InstanceCreationExpression;
import info.isaksson.erland.widgettoir.syntax.ListLiteral;
import info.isaksson.erland.widgettoir.syntax.NamedExpression;
import info.isaksson.erland.widgettoir.syntax.SetOrMapLiteral;
import info.isaksson.erland.widgettoir.syntax.SpreadElement;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;
import info.isaksson.erland.widgettoir.syntax.SyntaxPrinter;
import info.isaksson.erland.widgettoir.syntax.WhileStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Default detector: answers purely from the shape of the syntax tree.
 */
public final class AstComponentDetector implements ComponentDetector {

    public static final String ANONYMOUS_BUILDER = "anonymous_builder";
    public static final String ANONYMOUS_CALLBACK = "anonymous_callback";

    @Override
    public Boolean isWidgetCreation(SyntaxNode node) {
        return node instanceof InstanceCreationExpression;
    }

    @Override
    public Boolean isConditional(SyntaxNode node) {
        return node instanceof ConditionalExpression || node instanceof IfStatement || node instanceof IfElement;
    }

    @Override
    public Boolean isLoop(SyntaxNode node) {
        return node instanceof ForStatement || node instanceof ForElement || node instanceof WhileStatement;
    }

    @Override
    public Boolean isCollection(SyntaxNode node) {
        return node instanceof ListLiteral || node instanceof SetOrMapLiteral;
    }

    /** Closures and local functions taking at least one parameter. */
    @Override
    public Boolean isBuilder(SyntaxNode node) {
        FunctionExpression fn = function(node);
        return fn != null && !fn.parameterNames().isEmpty();
    }

    /** Closures and local functions taking at most two parameters. */
    @Override
    public Boolean isCallback(SyntaxNode node) {
        FunctionExpression fn = function(node);
        return fn != null && fn.parameterNames().size() <= 2;
    }

    @Override
    public String getWidgetName(SyntaxNode node) {
        return node instanceof InstanceCreationExpression ice ? ice.typeName() : null;
    }

    @Override
    public String getConstructorName(SyntaxNode node) {
        return node instanceof InstanceCreationExpression ice ? ice.constructorName() : null;
    }

    @Override
    public Boolean isConst(SyntaxNode node) {
        return node instanceof InstanceCreationExpression ice && ice.isConst();
    }

    /** One literal binding per named argument, value as source text. */
    @Override
    public List<PropertyBinding> getProperties(SyntaxNode node) {
        if (!(node instanceof InstanceCreationExpression ice)) return null;
        List<PropertyBinding> out = new ArrayList<>();
        for (NamedExpression arg : ice.arguments().named()) {
            out.add(PropertyBinding.literal(arg.name(), SyntaxPrinter.print(arg.expression())));
        }
        return out;
    }

    /** The {@code child} value followed by the elements of a {@code children} list literal. */
    @Override
    public List<CollectionElement> getChildElements(SyntaxNode node) {
        if (!(node instanceof InstanceCreationExpression ice)) return null;
        List<CollectionElement> out = new ArrayList<>();
        for (NamedExpression arg : ice.arguments().named()) {
            if (WidgetConventions.Properties.CHILD.equals(arg.name()) && arg.expression() != null) {
                out.add(arg.expression());
            } else if (WidgetConventions.Properties.CHILDREN.equals(arg.name())
                    && arg.expression() != null && arg.expression().unparenthesized() instanceof ListLiteral list) {
                out.addAll(list.elements());
            }
        }
        return out;
    }

    @Override
    public String getCondition(SyntaxNode node) {
        if (node instanceof ConditionalExpression c) return SyntaxPrinter.print(c.condition());
        if (node instanceof IfStatement s) return conditionText(s.condition(), s.caseClause());
        if (node instanceof IfElement e) return conditionText(e.condition(), e.caseClause());
        return null;
    }

    @Override
    public SyntaxNode getThenBranch(SyntaxNode node) {
        if (node instanceof ConditionalExpression c) return c.thenExpression();
        if (node instanceof IfStatement s) return s.thenStatement();
        if (node instanceof IfElement e) return e.thenElement();
        return null;
    }

    @Override
    public SyntaxNode getElseBranch(SyntaxNode node) {
        if (node instanceof ConditionalExpression c) return c.elseExpression();
        if (node instanceof IfStatement s) return s.elseStatement();
        if (node instanceof IfElement e) return e.elseElement();
        return null;
    }

    @Override
    public Boolean isTernary(SyntaxNode node) {
        return node instanceof ConditionalExpression;
    }

    @Override
    public String getLoopKind(SyntaxNode node) {
        if (node instanceof WhileStatement) return LoopComponent.WHILE;
        ForLoopParts parts = loopParts(node);
        if (parts == null) return null;
        return parts instanceof ForEachParts ? LoopComponent.FOR_EACH : LoopComponent.FOR;
    }

    @Override
    public String getLoopVariable(SyntaxNode node) {
        return loopParts(node) instanceof ForEachParts each ? each.variableName() : null;
    }

    @Override
    public String getIterable(SyntaxNode node) {
        return loopParts(node) instanceof ForEachParts each ? SyntaxPrinter.print(each.iterable()) : null;
    }

    @Override
    public String getLoopCondition(SyntaxNode node) {
        if (node instanceof WhileStatement w) return SyntaxPrinter.print(w.condition());
        if (loopParts(node) instanceof ForParts parts && parts.condition() != null) {
            return SyntaxPrinter.print(parts.condition());
        }
        return null;
    }

    @Override
    public SyntaxNode getLoopBody(SyntaxNode node) {
        if (node instanceof ForStatement f) return f.body();
        if (node instanceof ForElement f) return f.body();
        if (node instanceof WhileStatement w) return w.body();
        return null;
    }

    @Override
    public String getCollectionKind(SyntaxNode node) {
        if (node instanceof ListLiteral) return CollectionComponent.LIST;
        if (node instanceof SetOrMapLiteral s) return s.isMap() ? CollectionComponent.MAP : CollectionComponent.SET;
        return null;
    }

    @Override
    public Boolean hasSpread(SyntaxNode node) {
        List<CollectionElement> elements = getCollectionElements(node);
        if (elements == null) return null;
        for (CollectionElement e : elements) {
            if (e instanceof SpreadElement) return true;
        }
        return false;
    }

    @Override
    public List<CollectionElement> getCollectionElements(SyntaxNode node) {
        if (node instanceof ListLiteral l) return l.elements();
        if (node instanceof SetOrMapLiteral s) return s.elements();
        return null;
    }

    @Override
    public String getBuilderName(SyntaxNode node) {
        return functionName(node, ANONYMOUS_BUILDER);
    }

    @Override
    public List<String> getBuilderParameters(SyntaxNode node) {
        FunctionExpression fn = function(node);
        return fn == null ? null : fn.parameterNames();
    }

    @Override
    public Boolean isAsyncBuilder(SyntaxNode node) {
        FunctionExpression fn = function(node);
        return fn != null && fn.body().isAsync();
    }

    @Override
    public String getCallbackName(SyntaxNode node) {
        return functionName(node, ANONYMOUS_CALLBACK);
    }

    @Override
    public List<String> getCallbackParameters(SyntaxNode node) {
        return getBuilderParameters(node);
    }

    private static String conditionText(Expression condition, SyntaxNode caseClause) {
        String text = SyntaxPrinter.print(condition);
        return caseClause == null ? text : text + " " + SyntaxPrinter.print(caseClause);
    }

    private static ForLoopParts loopParts(SyntaxNode node) {
        if (node instanceof ForStatement f) return f.parts();
        if (node instanceof ForElement f) return f.parts();
        return null;
    }

    private static FunctionExpression function(SyntaxNode node) {
        if (node instanceof FunctionExpression fn) return fn;
        if (node instanceof FunctionDeclarationStatement s && s.function() != null) return s.function().function();
        if (node instanceof FunctionDeclaration d) return d.function();
        return null;
    }

    private static String functionName(SyntaxNode node, String anonymous) {
        if (node instanceof FunctionExpression) return anonymous;
        if (node instanceof FunctionDeclarationStatement s && s.function() != null) return s.function().name();
        if (node instanceof FunctionDeclaration d) return d.name();
        return null;
    }
}
