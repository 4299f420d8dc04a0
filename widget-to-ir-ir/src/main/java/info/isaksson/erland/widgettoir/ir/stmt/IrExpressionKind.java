package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification tag of an expression statement, so later passes can tell a framework
 * bootstrap call from a setter or a debug print without re-inspecting the expression.
 */
public enum IrExpressionKind {
    FRAMEWORK_INITIALIZATION("framework_initialization"),
    SETTER_CALL("setter_call"),
    GETTER_CALL("getter_call"),
    DEBUG_CALL("debug_call"),
    CONVERSION_CALL("conversion_call"),
    VALIDATION_CALL("validation_call"),
    BUILD_CALL("build_call"),
    FACTORY_CALL("factory_call"),
    INITIALIZATION_CALL("initialization_call"),
    METHOD_CALL("method_call"),

    ASYNC_CONSTRUCTION("async_construction"),
    STREAM_CONSTRUCTION("stream_construction"),
    STATE_CONSTRUCTION("state_construction"),
    ERROR_CONSTRUCTION("error_construction"),
    OBJECT_CONSTRUCTION("object_construction"),

    ARITHMETIC("arithmetic"),
    COMPARISON("comparison"),
    LOGICAL("logical"),
    BITWISE("bitwise"),
    NULL_COALESCE("null_coalesce"),

    LOGICAL_NEGATION("logical_negation"),
    ARITHMETIC_SIGN("arithmetic_sign"),
    INCREMENT_DECREMENT("increment_decrement"),
    BITWISE_NOT("bitwise_not"),

    INTEGER_LITERAL("integer_literal"),
    DOUBLE_LITERAL("double_literal"),
    STRING_LITERAL("string_literal"),
    BOOLEAN_LITERAL("boolean_literal"),
    NULL_LITERAL("null_literal"),
    LIST_LITERAL("list_literal"),
    MAP_OR_SET_LITERAL("map_or_set_literal"),

    SELF_REFERENCE("self_reference"),
    SUPER_REFERENCE("super_reference"),
    CONSTANT_REFERENCE("constant_reference"),
    VARIABLE_REFERENCE("variable_reference"),

    TERNARY_CONDITIONAL("ternary_conditional"),
    ASSIGNMENT("assignment"),
    TYPE_CHECK("type_check"),
    TYPE_CAST("type_cast"),
    CASCADE_CHAIN("cascade_chain"),
    LAMBDA_FUNCTION("lambda_function"),
    AWAIT_EXPRESSION("await_expression"),
    THROW_EXPRESSION("throw_expression"),
    UNKNOWN_EXPRESSION("unknown_expression");

    private final String tag;

    IrExpressionKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
