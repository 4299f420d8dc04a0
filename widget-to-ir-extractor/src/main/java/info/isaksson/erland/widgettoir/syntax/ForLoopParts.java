package info.isaksson.erland.widgettoir.syntax;

/** Header of a for statement or collection-for element. */
public sealed interface ForLoopParts extends SyntaxNode permits ForParts, ForEachParts {
}
