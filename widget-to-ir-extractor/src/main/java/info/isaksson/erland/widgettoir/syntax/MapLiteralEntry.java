package info.isaksson.erland.widgettoir.syntax;

public record MapLiteralEntry(Span span, Expression key, Expression value) implements CollectionElement {
}
