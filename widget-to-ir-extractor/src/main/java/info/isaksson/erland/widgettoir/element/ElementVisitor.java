package info.isaksson.erland.widgettoir.element;

public interface ElementVisitor<R> {
    R visitClass(ClassElement element);
    R visitMethod(MethodElement element);
    R visitAccessor(AccessorElement element);
    R visitConstructor(ConstructorElement element);
    R visitFunction(FunctionElement element);
    R visitField(FieldElement element);
    R visitParameter(ParameterElement element);
}
