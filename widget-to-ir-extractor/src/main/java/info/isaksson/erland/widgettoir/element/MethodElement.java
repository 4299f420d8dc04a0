package info.isaksson.erland.widgettoir.element;

public final class MethodElement extends ExecutableElement {

    public MethodElement(String name, String libraryUri, ClassElement enclosingClass) {
        super(name, libraryUri, enclosingClass);
    }

    @Override
    public <R> R accept(ElementVisitor<R> visitor) {
        return visitor.visitMethod(this);
    }
}
