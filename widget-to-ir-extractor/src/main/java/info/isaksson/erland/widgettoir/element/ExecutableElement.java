package info.isaksson.erland.widgettoir.element;

import java.util.ArrayList;
import java.util.List;

/** Anything with a parameter list and a return type. */
public abstract sealed class ExecutableElement extends Element
        permits MethodElement, AccessorElement, ConstructorElement, FunctionElement {
    /** Null for top-level functions. */
    public final ClassElement enclosingClass;
    public final List<ParameterElement> parameters = new ArrayList<>();
    /** Declared or inferred return type; null when the front-end supplied none. */
    public TypeRef returnType;
    public boolean isStatic;

    protected ExecutableElement(String name, String libraryUri, ClassElement enclosingClass) {
        super(name, libraryUri);
        this.enclosingClass = enclosingClass;
    }

    public ParameterElement addParameter(String parameterName, TypeRef type) {
        ParameterElement p = new ParameterElement(parameterName, libraryUri, type);
        parameters.add(p);
        return p;
    }
}
