package org.flutterjs.gen.printer;

import java.util.Set;

/**
 * Identifier rules of the target language.
 */
public final class JsNames {

    private static final Set<String> RESERVED_WORDS = Set.of(
            "abstract", "arguments", "await", "boolean", "break", "byte", "case", "catch", "char",
            "class", "const", "continue", "debugger", "default", "delete", "do", "double", "else",
            "enum", "eval", "export", "extends", "false", "final", "finally", "float", "for",
            "function", "goto", "if", "implements", "import", "in", "instanceof", "int", "interface",
            "let", "long", "native", "new", "null", "package", "private", "protected", "public",
            "return", "short", "static", "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "true", "try", "typeof", "var", "void", "volatile", "while", "with", "yield");

    private static final Set<String> RESERVED_MEMBERS = Set.of("constructor", "prototype", "__proto__");

    private JsNames() {
    }

    public static boolean isReserved(String name) {
        return RESERVED_WORDS.contains(name) || RESERVED_MEMBERS.contains(name);
    }

    /**
     * Rewrites a binding name that would collide with a reserved word, e.g. {@code default} to {@code $default}.
     */
    public static String safe(String name) {
        return isReserved(name) ? "$" + name : name;
    }

    /**
     * True for a well-formed identifier that is not reserved.
     */
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (!(Character.isLetter(first) || first == '_' || first == '$')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$')) {
                return false;
            }
        }
        return !RESERVED_WORDS.contains(name);
    }

    /**
     * Object-literal key: bare when it is a valid identifier, quoted otherwise.
     */
    public static String propertyKey(String name) {
        return isValidIdentifier(name) ? name : JsLiterals.quote(name);
    }
}
