package info.isaksson.erland.widgettoir.detect;

/** Every query the {@link DetectorRegistry} dispatches, keyed by its operation name. */
public enum DetectionOperation {
    IS_WIDGET_CREATION("isWidgetCreation"),
    IS_CONDITIONAL("isConditional"),
    IS_LOOP("isLoop"),
    IS_COLLECTION("isCollection"),
    IS_BUILDER("isBuilder"),
    IS_CALLBACK("isCallback"),
    GET_WIDGET_NAME("getWidgetName"),
    GET_CONSTRUCTOR_NAME("getConstructorName"),
    IS_CONST("isConst"),
    GET_PROPERTIES("getProperties"),
    GET_CHILD_ELEMENTS("getChildElements"),
    GET_CONDITION("getCondition"),
    GET_THEN_BRANCH("getThenBranch"),
    GET_ELSE_BRANCH("getElseBranch"),
    IS_TERNARY("isTernary"),
    GET_LOOP_KIND("getLoopKind"),
    GET_LOOP_VARIABLE("getLoopVariable"),
    GET_ITERABLE("getIterable"),
    GET_LOOP_CONDITION("getLoopCondition"),
    GET_LOOP_BODY("getLoopBody"),
    GET_COLLECTION_KIND("getCollectionKind"),
    HAS_SPREAD("hasSpread"),
    GET_COLLECTION_ELEMENTS("getCollectionElements"),
    GET_BUILDER_NAME("getBuilderName"),
    GET_BUILDER_PARAMETERS("getBuilderParameters"),
    IS_ASYNC_BUILDER("isAsyncBuilder"),
    GET_CALLBACK_NAME("getCallbackName"),
    GET_CALLBACK_PARAMETERS("getCallbackParameters");

    private final String key;

    DetectionOperation(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
