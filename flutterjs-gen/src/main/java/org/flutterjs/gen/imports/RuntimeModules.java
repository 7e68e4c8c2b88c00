package org.flutterjs.gen.imports;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symbols provided by the runtime itself: framework classes that are not widgets and the
 * core-library replacements. Widgets come from the widget registry instead.
 */
public final class RuntimeModules {

    public static final String MATERIAL = "@flutterjs/material";
    public static final String CORE_PREFIX = "@flutterjs/dart/";

    private static final Map<String, String> FRAMEWORK = Map.ofEntries(
            Map.entry("Widget", MATERIAL),
            Map.entry("StatelessWidget", MATERIAL),
            Map.entry("StatefulWidget", MATERIAL),
            Map.entry("State", MATERIAL),
            Map.entry("ChangeNotifier", MATERIAL),
            Map.entry("BuildContext", MATERIAL),
            Map.entry("Key", MATERIAL),
            Map.entry("ValueKey", MATERIAL),
            Map.entry("Colors", MATERIAL),
            Map.entry("Color", MATERIAL),
            Map.entry("Icons", MATERIAL),
            Map.entry("EdgeInsets", MATERIAL),
            Map.entry("TextStyle", MATERIAL),
            Map.entry("FontWeight", MATERIAL),
            Map.entry("Alignment", MATERIAL),
            Map.entry("MainAxisAlignment", MATERIAL),
            Map.entry("CrossAxisAlignment", MATERIAL),
            Map.entry("BoxDecoration", MATERIAL),
            Map.entry("BorderRadius", MATERIAL),
            Map.entry("Curves", MATERIAL),
            Map.entry("Theme", MATERIAL),
            Map.entry("ThemeData", MATERIAL),
            Map.entry("Navigator", MATERIAL),
            Map.entry("MediaQuery", MATERIAL),
            Map.entry("TextEditingController", MATERIAL),
            Map.entry("AnimationController", MATERIAL),
            Map.entry("runApp", MATERIAL),
            Map.entry("debugPrint", MATERIAL));

    private static final Map<String, String> CORE = Map.ofEntries(
            Map.entry("Duration", "dart:core"),
            Map.entry("DateTime", "dart:core"),
            Map.entry("Uri", "dart:core"),
            Map.entry("StringBuffer", "dart:core"),
            Map.entry("Exception", "dart:core"),
            Map.entry("FormatException", "dart:core"),
            Map.entry("StateError", "dart:core"),
            Map.entry("ArgumentError", "dart:core"),
            Map.entry("print", "dart:core"),
            Map.entry("identical", "dart:core"),
            Map.entry("Future", "dart:async"),
            Map.entry("Stream", "dart:async"),
            Map.entry("StreamController", "dart:async"),
            Map.entry("StreamSubscription", "dart:async"),
            Map.entry("Completer", "dart:async"),
            Map.entry("Timer", "dart:async"),
            Map.entry("Random", "dart:math"),
            Map.entry("jsonEncode", "dart:convert"),
            Map.entry("jsonDecode", "dart:convert"));

    /**
     * Lowercase names that are real runtime exports and must not be dropped by the
     * "lowercase means local" rule.
     */
    private static final Set<String> LOWERCASE_EXPORTS = Set.of(
            "runApp", "debugPrint", "print", "identical", "jsonEncode", "jsonDecode");

    /**
     * Names the target language provides without any import.
     */
    private static final Set<String> LANGUAGE_GLOBALS = Set.of(
            "undefined", "globalThis", "Math", "Object", "Array", "JSON", "Promise", "Symbol",
            "Number", "String", "Boolean", "Error", "TypeError", "RangeError", "console",
            "Map", "Set", "List", "int", "double", "num", "bool", "dynamic");

    private RuntimeModules() {
    }

    public static Optional<String> frameworkModule(String symbol) {
        return Optional.ofNullable(FRAMEWORK.get(symbol));
    }

    /**
     * The core library URI ({@code dart:async}, ...) that declares {@code symbol}.
     */
    public static Optional<String> coreLibrary(String symbol) {
        return Optional.ofNullable(CORE.get(symbol));
    }

    public static boolean isLowercaseExport(String symbol) {
        return LOWERCASE_EXPORTS.contains(symbol);
    }

    public static boolean isLanguageGlobal(String symbol) {
        return LANGUAGE_GLOBALS.contains(symbol);
    }
}
