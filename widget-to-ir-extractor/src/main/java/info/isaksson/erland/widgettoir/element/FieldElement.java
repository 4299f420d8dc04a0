package info.isaksson.erland.widgettoir.element;

/** Field, or top-level variable when {@link #enclosingClass} is null. */
public final class FieldElement extends Element {
    public final ClassElement enclosingClass;
    public TypeRef type;
    /** Synthetic or explicit getter; may be null. */
    public AccessorElement getter;
    public boolean isStatic;
    public boolean isFinal;

    public FieldElement(String name, String libraryUri, ClassElement enclosingClass) {
        super(name, libraryUri);
        this.enclosingClass = enclosingClass;
    }

    @Override
    public <R> R accept(ElementVisitor<R> visitor) {
        return visitor.visitField(this);
    }
}
