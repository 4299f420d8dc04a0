package info.isaksson.erland.widgettoir.element;

/**
 * Resolved semantic element supplied by the external front-end for a declaration.
 *
 * <p>Elements are built by the adapter and wired together afterwards (supertypes, members,
 * redirections), so their member collections are mutable. They use identity equality.</p>
 */
public abstract sealed class Element permits ClassElement, ExecutableElement, FieldElement, ParameterElement {
    public final String name;
    /** URI of the declaring library, e.g. {@code package:app/home.dart}. May be null. */
    public final String libraryUri;

    protected Element(String name, String libraryUri) {
        this.name = name == null ? "" : name;
        this.libraryUri = libraryUri;
    }

    public abstract <R> R accept(ElementVisitor<R> visitor);

    public String displayName() {
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + displayName() + ")";
    }
}
