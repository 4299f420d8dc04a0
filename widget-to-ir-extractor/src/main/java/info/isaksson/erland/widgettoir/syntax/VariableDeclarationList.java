package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

/** {@code late final int a = 1, b}; {@code keyword} is {@code var}, {@code final}, {@code const} or {@code null}. */
public record VariableDeclarationList(Span span, String keyword, boolean isLate, String type, List<VariableDeclaration> variables) implements SyntaxNode {

    public VariableDeclarationList {
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public boolean isFinal() {
        return "final".equals(keyword);
    }

    public boolean isConst() {
        return "const".equals(keyword);
    }
}
