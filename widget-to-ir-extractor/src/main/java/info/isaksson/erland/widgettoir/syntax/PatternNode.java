package info.isaksson.erland.widgettoir.syntax;

public sealed interface PatternNode extends SyntaxNode
        permits WildcardPattern, DeclaredVariablePattern, ConstantPattern, OpaquePattern {
}
