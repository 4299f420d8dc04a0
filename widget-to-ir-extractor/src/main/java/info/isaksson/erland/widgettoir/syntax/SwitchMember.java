package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public sealed interface SwitchMember extends SyntaxNode permits SwitchCase, SwitchPatternCase, SwitchDefault {

    List<String> labels();

    List<Statement> statements();
}
