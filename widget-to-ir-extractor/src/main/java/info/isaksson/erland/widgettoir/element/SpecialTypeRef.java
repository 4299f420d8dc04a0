package info.isaksson.erland.widgettoir.element;

public enum SpecialTypeRef implements TypeRef {
    DYNAMIC("dynamic"),
    VOID("void"),
    /** Bottom type. */
    NEVER("Never"),
    FUNCTION("Function");

    private final String displayName;

    SpecialTypeRef(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String displayName() {
        return displayName;
    }
}
