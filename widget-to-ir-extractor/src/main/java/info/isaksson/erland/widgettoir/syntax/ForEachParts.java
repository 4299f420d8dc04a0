package info.isaksson.erland.widgettoir.syntax;

/** {@code variable in iterable} header. */
public sealed interface ForEachParts extends ForLoopParts permits ForEachPartsWithDeclaration, ForEachPartsWithIdentifier {

    String variableName();

    Expression iterable();
}
