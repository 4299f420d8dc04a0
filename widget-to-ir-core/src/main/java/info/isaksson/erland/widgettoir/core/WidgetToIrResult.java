package info.isaksson.erland.widgettoir.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.widgettoir.component.Component;
import info.isaksson.erland.widgettoir.ir.IrJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Extraction result container for programmatic usage. */
@JsonPropertyOrder({"file", "contextHash", "declarations", "warnings", "registryStatistics", "extractorStatistics"})
public final class WidgetToIrResult {
    public final String file;

    /** Hash of the file path that prefixes every IR id issued for this file. */
    public final String contextHash;

    /** One record per declaration, classes before their members, in source order. */
    public final List<DeclarationRecord> declarations;

    /** Sorted by (code, message, context). */
    public final List<ExtractionWarning> warnings;

    /** Detector registry counters: cache hits/misses, detector errors, per-operation counts. */
    public final Map<String, Integer> registryStatistics;

    /** Component extractor counters. */
    public final Map<String, Integer> extractorStatistics;

    WidgetToIrResult(String file, String contextHash, List<DeclarationRecord> declarations,
                     List<ExtractionWarning> warnings, Map<String, Integer> registryStatistics,
                     Map<String, Integer> extractorStatistics) {
        this.file = file;
        this.contextHash = contextHash;
        this.declarations = List.copyOf(declarations);
        this.warnings = List.copyOf(warnings);
        this.registryStatistics = Collections.unmodifiableMap(new LinkedHashMap<>(registryStatistics));
        this.extractorStatistics = Collections.unmodifiableMap(new LinkedHashMap<>(extractorStatistics));
    }

    /** Every component tree of every declaration, in declaration order. */
    @JsonIgnore
    public List<Component> components() {
        List<Component> out = new ArrayList<>();
        for (DeclarationRecord d : declarations) out.addAll(d.components);
        return out;
    }

    @JsonIgnore
    public DeclarationRecord declaration(String qualifiedName) {
        for (DeclarationRecord d : declarations) {
            if (d.qualifiedName.equals(qualifiedName)) return d;
        }
        return null;
    }

    @JsonIgnore
    public List<ExtractionWarning> warnings(String code) {
        List<ExtractionWarning> out = new ArrayList<>();
        for (ExtractionWarning w : warnings) {
            if (w.code.equals(code)) out.add(w);
        }
        return out;
    }

    public String toJson() throws IOException {
        return IrJson.toJsonString(this);
    }

    public void writeJson(Path path) throws IOException {
        IrJson.write(this, path);
    }
}
