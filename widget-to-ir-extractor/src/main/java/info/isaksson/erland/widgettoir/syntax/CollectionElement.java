package info.isaksson.erland.widgettoir.syntax;

/** Element of a list, set or map literal. Every expression is also a collection element. */
public sealed interface CollectionElement extends SyntaxNode
        permits Expression, SpreadElement, IfElement, ForElement, MapLiteralEntry {
}
