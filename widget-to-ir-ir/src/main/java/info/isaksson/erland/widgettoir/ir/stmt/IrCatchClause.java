package info.isaksson.erland.widgettoir.ir.stmt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** {@code on Type catch (e, st) { ... }}; every part except the body is optional. */
@JsonPropertyOrder({"exceptionType","exceptionVariable","stackTraceVariable","body"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrCatchClause {
    public final String exceptionType;
    public final String exceptionVariable;
    public final String stackTraceVariable;
    public final IrBlockStatement body;

    public IrCatchClause(String exceptionType, String exceptionVariable, String stackTraceVariable,
                         IrBlockStatement body) {
        this.exceptionType = exceptionType;
        this.exceptionVariable = exceptionVariable;
        this.stackTraceVariable = stackTraceVariable;
        this.body = body;
    }
}
