package info.isaksson.erland.widgettoir.ir;

import java.util.List;
import java.util.Set;

/**
 * Naming conventions of the declarative UI framework that the resolver, detectors and the
 * component extractor rely on.
 *
 * <p>Kept as plain constants so every stage agrees on the same names. Unknown names must still be
 * handled gracefully.</p>
 */
public final class WidgetConventions {

    private WidgetConventions() {}

    /** Library that declares the framework root types below. */
    public static final String FRAMEWORK_LIBRARY = "package:flutter/widgets.dart";

    public static final String ROOT_COMPONENT_TYPE = "Widget";
    public static final String STATE_HOLDER_TYPE = "State";
    public static final String BUILD_METHOD = "build";
    public static final String BUILD_CONTEXT_TYPE = "BuildContext";

    /** Lower-case substrings that mark a builder-like executable name. */
    public static final List<String> BUILDER_NAME_MARKERS = List.of("build", "render");

    public static final class Properties {
        private Properties() {}

        public static final String CHILD = "child";
        public static final String CHILDREN = "children";
        public static final String FALLBACK = "fallback";
        public static final String ERROR = "error";

        public static final String CALLBACK_PREFIX = "on";
        public static final String CALLBACK_SUFFIX = "Callback";

        public static final String BUILDER = "builder";
        public static final String BUILDER_SUFFIX = "Builder";

        /** Named arguments whose value is extracted as a nested component. */
        public static final Set<String> COMPONENT_CARRYING = Set.of(CHILD, CHILDREN, FALLBACK, ERROR);
    }

    /** Framework widget names recognized without type information. */
    public static final List<String> KNOWN_WIDGETS = List.of(
            "Scaffold", "AppBar", "Container", "Column", "Row", "Center", "Text", "Button",
            "FloatingActionButton", "ListView", "GridView", "Stack", "Positioned",
            "GestureDetector", "InkWell", "MaterialApp", "ElevatedButton", "Icon", "Padding",
            "SizedBox", "Expanded", "Flexible", "Dialog", "AlertDialog", "Card", "ListTile",
            "Drawer", "TabBar", "TabBarView", "StatelessWidget", "StatefulWidget"
    );

    /** Entry-point call that boots the framework ({@code runApp(...)}). */
    public static final String RUN_APP = "runApp";
}
