package info.isaksson.erland.widgettoir.syntax;

/** Entry of a constructor's initializer list ({@code : a = 1, super(x)}). */
public sealed interface ConstructorInitializer extends SyntaxNode
        permits FieldInitializer, SuperConstructorInvocation, RedirectingConstructorInvocation, AssertInitializer {
}
