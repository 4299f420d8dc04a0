package info.isaksson.erland.widgettoir.element;

/** Reference to a type parameter {@code T extends Bound}; {@code bound} is null when unbounded. */
public record TypeParameterTypeRef(String name, TypeRef bound) implements TypeRef {

    @Override
    public String displayName() {
        return name;
    }
}
