package info.isaksson.erland.widgettoir.syntax;

/**
 * Root of the syntax-tree adapter boundary.
 *
 * <p>The external front-end converts its own parse tree into these immutable records. The
 * hierarchy is closed so extraction code can switch over it exhaustively; shapes the adapter does
 * not model travel as {@link OpaqueExpression}, {@link OpaqueStatement} or {@link OpaquePattern}.</p>
 */
public sealed interface SyntaxNode permits CollectionElement, InterpolationElement, Statement, FunctionBody,
        ForLoopParts, SwitchMember, PatternNode, ConstructorInitializer, Declaration, CompilationUnit,
        ArgumentList, FormalParameterList, FormalParameter, VariableDeclarationList, VariableDeclaration,
        DeclaredIdentifier, CatchClause, CaseClause, GuardedPattern, SwitchExpressionCase {

    Span span();

    /** Shape name, e.g. {@code InstanceCreationExpression}. */
    default String nodeType() {
        return getClass().getSimpleName();
    }

    /** Canonical source rendering. */
    default String toSource() {
        return SyntaxPrinter.print(this);
    }
}
