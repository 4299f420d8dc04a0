package info.isaksson.erland.widgettoir.core;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings during extraction.
 *
 * <p>Warnings are deterministic: final output is sorted by (code, message, contextString).</p>
 */
public final class ExtractionWarnings {

    public static final String UNSUPPORTED_COMPONENT = "UNSUPPORTED_COMPONENT";
    public static final String COMPONENT_FALLBACK = "COMPONENT_FALLBACK";
    public static final String UNKNOWN_EXPRESSION = "UNKNOWN_EXPRESSION";
    public static final String UNKNOWN_STATEMENT = "UNKNOWN_STATEMENT";
    public static final String MISSING_ELEMENT = "MISSING_ELEMENT";

    private final List<ExtractionWarning> warnings = new ArrayList<>();

    public void warn(String code, String message) {
        warn(code, message, (Map<String, String>) null);
    }

    public void warn(String code, String message, Map<String, String> context) {
        warnings.add(new ExtractionWarning(code, message, context == null ? Collections.emptyMap() : context));
    }

    /** Warning anchored at a source location, with extra context pairs ({@code k1, v1, k2, v2...}). */
    public void warn(String code, String message, IrSourceLocation location, String... extra) {
        Map<String, String> ctx = new LinkedHashMap<>();
        if (location != null) {
            ctx.put("file", location.file);
            ctx.put("line", Integer.toString(location.line));
            ctx.put("column", Integer.toString(location.column));
        }
        for (int i = 0; i + 1 < extra.length; i += 2) {
            ctx.put(extra[i], extra[i + 1]);
        }
        warn(code, message, ctx);
    }

    public int size() {
        return warnings.size();
    }

    public List<ExtractionWarning> toDeterministicList() {
        List<ExtractionWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((ExtractionWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // stable serialization: key-sorted
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
