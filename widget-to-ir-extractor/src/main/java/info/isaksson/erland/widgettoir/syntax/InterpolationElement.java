package info.isaksson.erland.widgettoir.syntax;

public sealed interface InterpolationElement extends SyntaxNode permits InterpolationString, InterpolationExpression {
}
