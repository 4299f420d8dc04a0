package info.isaksson.erland.widgettoir.core;

import info.isaksson.erland.widgettoir.detect.DetectorRegistry;
import info.isaksson.erland.widgettoir.extract.ComponentExtractor;
import info.isaksson.erland.widgettoir.ir.WidgetConventions;

import java.util.List;

/**
 * Options for one {@link WidgetToIrService#extractFile} run.
 *
 * <p>Plain public fields with defaults; a {@code null} options object means all defaults.</p>
 */
public final class WidgetToIrOptions {

    /** Nesting depth after which the component extractor substitutes a container fallback. */
    public int maxRecursionDepth = ComponentExtractor.DEFAULT_MAX_DEPTH;

    /** Entry limit of the detector registry's query cache. */
    public int detectionCacheLimit = DetectorRegistry.DEFAULT_CACHE_LIMIT;

    /** Library that declares the root component, state holder and build-context types. */
    public String frameworkLibraryUri = WidgetConventions.FRAMEWORK_LIBRARY;

    /** Project widget names recognized in addition to the framework's. */
    public List<String> additionalKnownWidgets = List.of();

    /** Build component trees for widget-producing declarations. */
    public boolean extractComponents = true;

    /** Normalize declaration bodies into IR statements. */
    public boolean includeBodies = true;
}
