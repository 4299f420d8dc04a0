package info.isaksson.erland.widgettoir.core;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeclarationKind {
    CLASS("class"),
    CONSTRUCTOR("constructor"),
    METHOD("method"),
    GETTER("getter"),
    SETTER("setter"),
    FIELD("field"),
    FUNCTION("function"),
    TOP_LEVEL_VARIABLE("top_level_variable");

    private final String tag;

    DeclarationKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
