package info.isaksson.erland.widgettoir.syntax;

public interface StatementVisitor<R> {
    R visitBlock(Block node);
    R visitVariableDeclarationStatement(VariableDeclarationStatement node);
    R visitExpressionStatement(ExpressionStatement node);
    R visitReturnStatement(ReturnStatement node);
    R visitIfStatement(IfStatement node);
    R visitForStatement(ForStatement node);
    R visitWhileStatement(WhileStatement node);
    R visitDoStatement(DoStatement node);
    R visitTryStatement(TryStatement node);
    R visitSwitchStatement(SwitchStatement node);
    R visitBreakStatement(BreakStatement node);
    R visitContinueStatement(ContinueStatement node);
    R visitAssertStatement(AssertStatement node);
    R visitLabeledStatement(LabeledStatement node);
    R visitYieldStatement(YieldStatement node);
    R visitFunctionDeclarationStatement(FunctionDeclarationStatement node);
    R visitEmptyStatement(EmptyStatement node);
    R visitOpaqueStatement(OpaqueStatement node);
}
