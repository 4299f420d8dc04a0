package info.isaksson.erland.widgettoir.component;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a named constructor argument of a widget is bound. */
public enum PropertyType {
    /** {@code color: Colors.red}; the default classification. */
    LITERAL("literal"),
    /** {@code child: myWidget}; reserved for passes that resolve identifiers. */
    VARIABLE("variable"),
    /** {@code onTap: () { ... }} */
    CALLBACK("callback"),
    /** {@code builder: (context) => ...} */
    BUILDER("builder"),
    /** Value extracted as a nested component, e.g. {@code appBar: AppBar(...)}. */
    EXPRESSION("expression");

    private final String tag;

    PropertyType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
