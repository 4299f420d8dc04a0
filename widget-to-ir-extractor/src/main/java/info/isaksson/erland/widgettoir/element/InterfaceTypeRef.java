package info.isaksson.erland.widgettoir.element;

import java.util.List;
import java.util.stream.Collectors;

/** {@code List<Widget>}, {@code Future<Text>}, {@code MyWidget}. */
public record InterfaceTypeRef(ClassElement element, List<TypeRef> typeArguments) implements TypeRef {

    public InterfaceTypeRef {
        if (element == null) throw new IllegalArgumentException("element must not be null");
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
    }

    public static InterfaceTypeRef of(ClassElement element, TypeRef... typeArguments) {
        return new InterfaceTypeRef(element, List.of(typeArguments));
    }

    @Override
    public String displayName() {
        if (typeArguments.isEmpty()) return element.name;
        return element.name + "<" + typeArguments.stream().map(TypeRef::displayName).collect(Collectors.joining(", ")) + ">";
    }
}
