package org.flutterjs.gen.printer;

/**
 * Escaping for string and template literals.
 */
public final class JsLiterals {

    private JsLiterals() {
    }

    /**
     * Double-quoted string literal.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Literal text inside a template literal. Line breaks are escaped so that generated
     * code keeps one logical line per physical line.
     */
    public static String templateText(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '`' -> sb.append("\\`");
                case '$' -> sb.append("\\$");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Text safe to place inside a block comment.
     */
    public static String commentText(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("*/", "* /").replace('\n', ' ').replace('\r', ' ');
    }
}
