package info.isaksson.erland.widgettoir.syntax;

public sealed interface Statement extends SyntaxNode permits
        Block, VariableDeclarationStatement, ExpressionStatement, ReturnStatement, IfStatement, ForStatement,
        WhileStatement, DoStatement, TryStatement, SwitchStatement, BreakStatement, ContinueStatement,
        AssertStatement, LabeledStatement, YieldStatement, FunctionDeclarationStatement, EmptyStatement,
        OpaqueStatement {

    <R> R accept(StatementVisitor<R> visitor);
}
