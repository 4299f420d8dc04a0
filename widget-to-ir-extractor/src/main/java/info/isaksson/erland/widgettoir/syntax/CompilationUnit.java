package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record CompilationUnit(Span span, List<Declaration> declarations) implements SyntaxNode {

    public CompilationUnit {
        declarations = declarations == null ? List.of() : List.copyOf(declarations);
    }
}
