package info.isaksson.erland.widgettoir.element;

public final class ParameterElement extends Element {
    public final TypeRef type;

    public ParameterElement(String name, String libraryUri, TypeRef type) {
        super(name, libraryUri);
        this.type = type;
    }

    @Override
    public <R> R accept(ElementVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }
}
