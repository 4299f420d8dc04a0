package info.isaksson.erland.widgettoir.element;

/** Explicit or synthetic getter/setter. */
public final class AccessorElement extends ExecutableElement {
    public final boolean isGetter;

    public AccessorElement(String name, String libraryUri, ClassElement enclosingClass, boolean isGetter) {
        super(name, libraryUri, enclosingClass);
        this.isGetter = isGetter;
    }

    public boolean isSetter() {
        return !isGetter;
    }

    @Override
    public <R> R accept(ElementVisitor<R> visitor) {
        return visitor.visitAccessor(this);
    }
}
