package info.isaksson.erland.widgettoir.element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ClassElement extends Element {
    /** {@code extends} clause; null for the root of a hierarchy. */
    public InterfaceTypeRef supertype;
    public final List<InterfaceTypeRef> interfaces = new ArrayList<>();
    public final List<InterfaceTypeRef> mixins = new ArrayList<>();
    public final List<TypeParameterTypeRef> typeParameters = new ArrayList<>();

    public final List<MethodElement> methods = new ArrayList<>();
    public final List<ConstructorElement> constructors = new ArrayList<>();
    public final List<FieldElement> fields = new ArrayList<>();
    public final List<AccessorElement> accessors = new ArrayList<>();

    public boolean isAbstract;

    public ClassElement(String name, String libraryUri) {
        super(name, libraryUri);
    }

    /** The type {@code Name<T1, ..., Tn>} of this class, using its own type parameters. */
    public InterfaceTypeRef thisType() {
        return new InterfaceTypeRef(this, new ArrayList<>(typeParameters));
    }

    /**
     * Every class reachable through {@code extends}, {@code with} and {@code implements}, breadth
     * first, excluding this class. Cyclic hierarchies terminate.
     */
    public Set<ClassElement> allSupertypes() {
        Set<ClassElement> seen = new LinkedHashSet<>();
        List<ClassElement> queue = new ArrayList<>();
        queue.add(this);
        for (int i = 0; i < queue.size(); i++) {
            ClassElement c = queue.get(i);
            for (InterfaceTypeRef t : c.directSupertypes()) {
                if (t.element() != this && seen.add(t.element())) queue.add(t.element());
            }
        }
        return seen;
    }

    public List<InterfaceTypeRef> directSupertypes() {
        List<InterfaceTypeRef> out = new ArrayList<>();
        if (supertype != null) out.add(supertype);
        out.addAll(mixins);
        out.addAll(interfaces);
        return out;
    }

    public MethodElement method(String methodName) {
        for (MethodElement m : methods) {
            if (m.name.equals(methodName)) return m;
        }
        return null;
    }

    public MethodElement addMethod(String methodName, TypeRef returnType) {
        MethodElement m = new MethodElement(methodName, libraryUri, this);
        m.returnType = returnType;
        methods.add(m);
        return m;
    }

    public ConstructorElement addConstructor(String constructorName) {
        ConstructorElement c = new ConstructorElement(constructorName, this);
        constructors.add(c);
        return c;
    }

    public FieldElement addField(String fieldName, TypeRef type) {
        FieldElement f = new FieldElement(fieldName, libraryUri, this);
        f.type = type;
        fields.add(f);
        return f;
    }

    @Override
    public <R> R accept(ElementVisitor<R> visitor) {
        return visitor.visitClass(this);
    }
}
