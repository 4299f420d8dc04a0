package info.isaksson.erland.widgettoir.component;

import java.util.List;
import java.util.Objects;

/**
 * Named argument of a widget constructor call, classified by {@link PropertyType}.
 *
 * <p>{@link #value} is always the argument's source text. Callback and builder bindings also carry
 * the closure's parameter names and async flag; expression bindings carry the nested
 * component.</p>
 */
public final class PropertyBinding {
    public final String name;
    public final String value;
    public final PropertyType type;
    public final List<String> parameters;
    public final boolean isAsync;
    public final Component component;

    public PropertyBinding(String name, String value, PropertyType type, List<String> parameters,
                           boolean isAsync, Component component) {
        this.name = name;
        this.value = value == null ? "" : value;
        this.type = type == null ? PropertyType.LITERAL : type;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.isAsync = isAsync;
        this.component = component;
    }

    public static PropertyBinding literal(String name, String value) {
        return new PropertyBinding(name, value, PropertyType.LITERAL, null, false, null);
    }

    public static PropertyBinding callback(String name, String value, List<String> parameters, boolean isAsync) {
        return new PropertyBinding(name, value, PropertyType.CALLBACK, parameters, isAsync, null);
    }

    public static PropertyBinding builder(String name, String value, List<String> parameters, boolean isAsync) {
        return new PropertyBinding(name, value, PropertyType.BUILDER, parameters, isAsync, null);
    }

    public static PropertyBinding expression(String name, String value, Component component) {
        return new PropertyBinding(name, value, PropertyType.EXPRESSION, null, false, component);
    }

    public boolean carriesParameters() {
        return type == PropertyType.CALLBACK || type == PropertyType.BUILDER;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyBinding)) return false;
        PropertyBinding that = (PropertyBinding) o;
        return isAsync == that.isAsync &&
                Objects.equals(name, that.name) &&
                Objects.equals(value, that.value) &&
                type == that.type &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(component, that.component);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value, type, parameters, isAsync);
    }

    @Override public String toString() {
        return name + "=" + value + " (" + type.tag() + ")";
    }
}
