package info.isaksson.erland.widgettoir.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal deterministic warning produced while extracting a file. */
public final class ExtractionWarning {

    /** Warning code stable across versions; one of the {@link ExtractionWarnings} constants. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Structured context: {@code file}, {@code line}, {@code column} and code-specific keys. */
    public final Map<String, String> context;

    public ExtractionWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override
    public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
