package info.isaksson.erland.widgettoir.extract;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrLambdaExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrPattern;
import info.isaksson.erland.widgettoir.ir.expr.IrUnknownExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrUnknownPattern;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrUnknownStatement;
import info.isaksson.erland.widgettoir.source.LocationMapper;
import info.isaksson.erland.widgettoir.syntax.BlockFunctionBody;
import info.isaksson.erland.widgettoir.syntax.CollectionElement;
import info.isaksson.erland.widgettoir.syntax.ConstructorDeclaration;
import info.isaksson.erland.widgettoir.syntax.ConstructorInitializer;
import info.isaksson.erland.widgettoir.syntax.EmptyFunctionBody;
import info.isaksson.erland.widgettoir.syntax.Expression;
import info.isaksson.erland.widgettoir.syntax.ExpressionFunctionBody;
import info.isaksson.erland.widgettoir.syntax.FunctionBody;
import info.isaksson.erland.widgettoir.syntax.FunctionExpression;
import info.isaksson.erland.widgettoir.syntax.PatternNode;
import info.isaksson.erland.widgettoir.syntax.Statement;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;
import info.isaksson.erland.widgettoir.syntax.SyntaxPrinter;
import info.isaksson.erland.widgettoir.syntax.VariableDeclarationList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Normalizes statements and expressions of one file into the IR.
 *
 * <p>Every public method is total: shapes without a dedicated IR form become
 * {@link IrUnknownExpression} / {@link IrUnknownStatement} nodes carrying the source text, and a
 * failure while extracting a nested construct is replaced by an unknown node annotated with the
 * error, so one bad sub-tree never takes the rest of the file with it.</p>
 *
 * <p>Holds per-file state (id counter, unknown-node log); not thread-safe.</p>
 */
public final class IrExtractor {

    static final String ERROR_KEY = "error";

    private final LocationMapper locations;
    private final IrIdGenerator ids;
    private final ExpressionExtractor expressions;
    private final StatementExtractor statements;

    private final List<IrUnknownExpression> unknownExpressions = new ArrayList<>();
    private final List<IrUnknownStatement> unknownStatements = new ArrayList<>();

    public IrExtractor(LocationMapper locations, IrIdGenerator ids) {
        if (locations == null || ids == null) throw new IllegalArgumentException("locations and ids are required");
        this.locations = locations;
        this.ids = ids;
        this.expressions = new ExpressionExtractor(this);
        this.statements = new StatementExtractor(this);
    }

    public IrExpression extractExpression(Expression node) {
        if (node == null) return unknownExpression(null, "Missing expression");
        try {
            return node.accept(expressions);
        } catch (RuntimeException e) {
            return failedExpression(node, e);
        }
    }

    public IrStatement extractStatement(Statement node) {
        if (node == null) return unknownStatement(null, "Missing statement");
        try {
            return node.accept(statements);
        } catch (RuntimeException e) {
            return failedStatement(node, e);
        }
    }

    /**
     * Statements of a function body. A block body yields its statements, an arrow body a single
     * return statement and an empty body nothing.
     */
    public List<IrStatement> extractBodyStatements(FunctionBody body) {
        if (body == null || body instanceof EmptyFunctionBody) return List.of();
        if (body instanceof ExpressionFunctionBody arrow) {
            return List.of(statements.returnOf(arrow));
        }
        List<IrStatement> out = new ArrayList<>();
        for (Statement s : ((BlockFunctionBody) body).block().statements()) {
            out.add(extractStatement(s));
        }
        return out;
    }

    /** One element of a list/set/map literal; spreads, collection-if and collection-for included. */
    public IrExpression extractCollectionElement(CollectionElement element) {
        if (element == null) return unknownExpression(null, "Missing collection element");
        try {
            return expressions.collectionElement(element);
        } catch (RuntimeException e) {
            return failedExpression(element, e);
        }
    }

    public IrPattern extractPattern(PatternNode pattern) {
        if (pattern == null) return new IrUnknownPattern(ids.next("pattern"), IrSourceLocation.unknown(locations.file()), "", "Missing pattern");
        try {
            return expressions.pattern(pattern);
        } catch (RuntimeException e) {
            return new IrUnknownPattern(ids.next("pattern"), locate(pattern), SyntaxPrinter.print(pattern), errorReason(e));
        }
    }

    public IrLambdaExpression extractFunction(FunctionExpression function) {
        return expressions.lambda(function);
    }

    /** Field or top-level variable declaration, as a single declaration statement. */
    public IrStatement extractVariables(VariableDeclarationList list) {
        if (list == null) return unknownStatement(null, "Missing variable declaration");
        try {
            return statements.variables(list, null);
        } catch (RuntimeException e) {
            return failedStatement(list, e);
        }
    }

    /** Initializer list of a constructor, one statement per entry, in source order. */
    public List<IrStatement> extractConstructorInitializers(ConstructorDeclaration constructor) {
        if (constructor == null) return List.of();
        List<IrStatement> out = new ArrayList<>();
        for (ConstructorInitializer init : constructor.initializers()) {
            try {
                out.add(statements.initializer(init));
            } catch (RuntimeException e) {
                out.add(failedStatement(init, e));
            }
        }
        return out;
    }

    public List<IrUnknownExpression> unknownExpressions() {
        return List.copyOf(unknownExpressions);
    }

    public List<IrUnknownStatement> unknownStatements() {
        return List.copyOf(unknownStatements);
    }

    public String file() {
        return locations.file();
    }

    // ---------------------------------------------------------------------------------------------
    // Shared helpers for the package-private visitors
    // ---------------------------------------------------------------------------------------------

    ExpressionExtractor expressions() {
        return expressions;
    }

    IrSourceLocation locate(SyntaxNode node) {
        return locations.locate(node);
    }

    String nextId(String type) {
        return ids.next(type);
    }

    String nextId(String type, String name) {
        return ids.next(type, name);
    }

    IrUnknownExpression unknownExpression(SyntaxNode node, String reason) {
        return unknownExpression(node, reason, Map.of());
    }

    IrUnknownExpression unknownExpression(SyntaxNode node, String reason, Map<String, Object> metadata) {
        IrUnknownExpression u = new IrUnknownExpression(ids.next("unknown"), locate(node), metadata,
                node == null ? "" : SyntaxPrinter.print(node), reason);
        unknownExpressions.add(u);
        return u;
    }

    IrUnknownStatement unknownStatement(SyntaxNode node, String reason) {
        return unknownStatement(node, reason, Map.of());
    }

    IrUnknownStatement unknownStatement(SyntaxNode node, String reason, Map<String, Object> metadata) {
        IrUnknownStatement u = new IrUnknownStatement(ids.next("unknownStmt"), locate(node), metadata,
                node == null ? "" : SyntaxPrinter.print(node), reason);
        unknownStatements.add(u);
        return u;
    }

    private IrUnknownExpression failedExpression(SyntaxNode node, RuntimeException e) {
        return unknownExpression(node, errorReason(e), Map.of(ERROR_KEY, String.valueOf(e.getMessage())));
    }

    private IrUnknownStatement failedStatement(SyntaxNode node, RuntimeException e) {
        return unknownStatement(node, errorReason(e), Map.of(ERROR_KEY, String.valueOf(e.getMessage())));
    }

    static String errorReason(RuntimeException e) {
        return "Extraction failed: " + e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }
}
