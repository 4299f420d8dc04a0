package info.isaksson.erland.widgettoir.syntax;

/** {@code ...items} / {@code ...?items}. */
public record SpreadElement(Span span, Expression expression, boolean nullAware) implements CollectionElement {
}
