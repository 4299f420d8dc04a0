package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** Classic {@code init; condition; updaters} header. */
public sealed interface ForParts extends ForLoopParts permits ForPartsWithDeclarations, ForPartsWithExpressions {

    Expression condition();

    List<Expression> updaters();
}
