package org.flutterjs.gen.validate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks over generated JavaScript.
 * <p>
 * Delimiter balance is checked with a small lexer that skips string literals, template literal
 * text and comments, so braces inside {@code "{"} or {@code // }} are not counted. Expressions
 * inside {@code ${...}} are scanned as code. Regular expression literals are not recognised.
 */
public final class OutputValidator {

    private static final Logger log = LoggerFactory.getLogger(OutputValidator.class);

    private static final Pattern MARKER = Pattern.compile("\\b(TODO|FIXME)\\b");

    private enum Mode { CODE, SINGLE_QUOTED, DOUBLE_QUOTED, TEMPLATE, LINE_COMMENT, BLOCK_COMMENT }

    private record Open(char delimiter, int line, boolean templateExpression) {
    }

    private final int minimumOutputSize;

    public OutputValidator(int minimumOutputSize) {
        this.minimumOutputSize = minimumOutputSize;
    }

    public ValidationReport validate(String source) {
        List<ValidationIssue> issues = new ArrayList<>();
        checkDelimiters(source, issues);
        checkMarkers(source, issues);
        if (source.trim().length() < minimumOutputSize) {
            issues.add(ValidationIssue.warning("Output is only " + source.trim().length()
                    + " characters, generation may have been truncated", 0));
        }
        log.debug("Validated {} characters: {} issue(s)", source.length(), issues.size());
        return new ValidationReport(issues);
    }

    static void checkDelimiters(String source, List<ValidationIssue> issues) {
        Deque<Open> open = new ArrayDeque<>();
        Mode mode = Mode.CODE;
        int line = 1;
        int stringStart = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
            if (c == '\n') {
                line++;
            }
            switch (mode) {
                case LINE_COMMENT -> {
                    if (c == '\n') {
                        mode = Mode.CODE;
                    }
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        mode = Mode.CODE;
                        i++;
                    }
                }
                case SINGLE_QUOTED, DOUBLE_QUOTED -> {
                    char quote = mode == Mode.SINGLE_QUOTED ? '\'' : '"';
                    if (c == '\\') {
                        i++;
                    } else if (c == quote) {
                        mode = Mode.CODE;
                    } else if (c == '\n') {
                        issues.add(ValidationIssue.critical("Unterminated string literal", stringStart));
                        mode = Mode.CODE;
                    }
                }
                case TEMPLATE -> {
                    if (c == '\\') {
                        if (next == '\n') {
                            line++;
                        }
                        i++;
                    } else if (c == '`') {
                        mode = Mode.CODE;
                    } else if (c == '$' && next == '{') {
                        open.push(new Open('{', line, true));
                        mode = Mode.CODE;
                        i++;
                    }
                }
                case CODE -> {
                    if (c == '/' && next == '/') {
                        mode = Mode.LINE_COMMENT;
                        i++;
                    } else if (c == '/' && next == '*') {
                        mode = Mode.BLOCK_COMMENT;
                        i++;
                    } else if (c == '\'') {
                        mode = Mode.SINGLE_QUOTED;
                        stringStart = line;
                    } else if (c == '"') {
                        mode = Mode.DOUBLE_QUOTED;
                        stringStart = line;
                    } else if (c == '`') {
                        mode = Mode.TEMPLATE;
                        stringStart = line;
                    } else if (c == '(' || c == '[' || c == '{') {
                        open.push(new Open(c, line, false));
                    } else if (c == ')' || c == ']' || c == '}') {
                        mode = close(c, line, open, issues);
                    }
                }
                default -> throw new IllegalStateException("Unexpected lexer mode " + mode);
            }
        }
        switch (mode) {
            case BLOCK_COMMENT -> issues.add(ValidationIssue.critical("Unterminated block comment", line));
            case TEMPLATE -> issues.add(ValidationIssue.critical("Unterminated template literal", stringStart));
            case SINGLE_QUOTED, DOUBLE_QUOTED -> issues.add(ValidationIssue.critical("Unterminated string literal", stringStart));
            default -> {
            }
        }
        for (Open unclosed : open) {
            issues.add(ValidationIssue.critical("Unclosed '" + unclosed.delimiter() + "'", unclosed.line()));
        }
    }

    private static Mode close(char c, int line, Deque<Open> open, List<ValidationIssue> issues) {
        if (open.isEmpty()) {
            issues.add(ValidationIssue.critical("Unexpected '" + c + "' with nothing open", line));
            return Mode.CODE;
        }
        Open top = open.peek();
        if (top.delimiter() != opening(c)) {
            issues.add(ValidationIssue.critical("Mismatched '" + c + "', expected the closer of '"
                    + top.delimiter() + "' opened at line " + top.line(), line));
            return Mode.CODE;
        }
        open.pop();
        return top.templateExpression() ? Mode.TEMPLATE : Mode.CODE;
    }

    private static char opening(char closer) {
        return switch (closer) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    private static void checkMarkers(String source, List<ValidationIssue> issues) {
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (MARKER.matcher(lines[i]).find()) {
                issues.add(ValidationIssue.warning("Leftover marker: " + lines[i].trim(), i + 1));
            }
        }
    }
}
