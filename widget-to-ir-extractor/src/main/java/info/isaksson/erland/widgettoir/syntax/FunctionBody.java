package info.isaksson.erland.widgettoir.syntax;

/** Body of a closure, method, constructor or function. */
public sealed interface FunctionBody extends SyntaxNode permits BlockFunctionBody, ExpressionFunctionBody, EmptyFunctionBody {

    boolean isAsync();

    boolean isGenerator();
}
