package info.isaksson.erland.widgettoir.element;

public final class ConstructorElement extends ExecutableElement {
    public boolean isConst;
    public boolean isFactory;
    /** Target of {@code factory A() = B;}, when this constructor redirects. */
    public ConstructorElement redirectedConstructor;

    /**
     * @param name constructor name; empty for the unnamed constructor
     */
    public ConstructorElement(String name, ClassElement enclosingClass) {
        super(name, enclosingClass == null ? null : enclosingClass.libraryUri, enclosingClass);
        if (enclosingClass != null) {
            this.returnType = enclosingClass.thisType();
        }
    }

    @Override
    public String displayName() {
        String owner = enclosingClass == null ? "" : enclosingClass.name;
        return name.isEmpty() ? owner : owner + "." + name;
    }

    @Override
    public <R> R accept(ElementVisitor<R> visitor) {
        return visitor.visitConstructor(this);
    }
}
