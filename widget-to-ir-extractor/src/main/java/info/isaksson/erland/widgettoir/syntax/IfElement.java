package info.isaksson.erland.widgettoir.syntax;

/** Collection-if {@code if (c) a else b}; {@code caseClause} is set for {@code if (x case P)}. */
public record IfElement(Span span, Expression condition, CaseClause caseClause, CollectionElement thenElement, CollectionElement elseElement) implements CollectionElement {
}
