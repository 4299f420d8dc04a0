package info.isaksson.erland.widgettoir.component;

import com.fasterxml.jackson.annotation.JsonValue;

/** Value of the {@code type} field in the component JSON projection. */
public enum ComponentType {
    WIDGET("widget"),
    BUILDER("builder"),
    CONDITIONAL("conditional"),
    LOOP("loop"),
    COLLECTION("collection"),
    UNSUPPORTED("unsupported"),
    CONTAINER_FALLBACK("container_fallback");

    private final String tag;

    ComponentType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
