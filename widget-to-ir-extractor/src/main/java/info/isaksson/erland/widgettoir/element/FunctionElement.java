package info.isaksson.erland.widgettoir.element;

/** Top-level or local function. */
public final class FunctionElement extends ExecutableElement {

    public FunctionElement(String name, String libraryUri) {
        super(name, libraryUri, null);
    }

    @Override
    public <R> R accept(ElementVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
