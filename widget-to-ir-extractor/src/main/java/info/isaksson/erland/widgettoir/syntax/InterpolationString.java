package info.isaksson.erland.widgettoir.syntax;

public record InterpolationString(Span span, String value) implements InterpolationElement {
}
