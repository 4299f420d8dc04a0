package info.isaksson.erland.widgettoir.syntax;

/** Collection-for {@code for (final x in xs) f(x)}. */
public record ForElement(Span span, boolean isAwait, ForLoopParts parts, CollectionElement body) implements CollectionElement {
}
