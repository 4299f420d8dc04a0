package info.isaksson.erland.widgettoir.ir.stmt;

/** Exhaustive dispatch over {@link IrStatement} variants. */
public interface IrStatementVisitor<R> {
    R visitBlock(IrBlockStatement s);
    R visitVariableDeclaration(IrVariableDeclarationStatement s);
    R visitExpressionStatement(IrExpressionStatement s);
    R visitReturn(IrReturnStatement s);
    R visitBreak(IrBreakStatement s);
    R visitContinue(IrContinueStatement s);
    R visitThrow(IrThrowStatement s);
    R visitAssert(IrAssertStatement s);
    R visitIf(IrIfStatement s);
    R visitFor(IrForStatement s);
    R visitForEach(IrForEachStatement s);
    R visitWhile(IrWhileStatement s);
    R visitDoWhile(IrDoWhileStatement s);
    R visitTry(IrTryStatement s);
    R visitSwitch(IrSwitchStatement s);
    R visitLabeled(IrLabeledStatement s);
    R visitYield(IrYieldStatement s);
    R visitFunctionDeclaration(IrFunctionDeclarationStatement s);
    R visitEmpty(IrEmptyStatement s);
    R visitUnknown(IrUnknownStatement s);
}
