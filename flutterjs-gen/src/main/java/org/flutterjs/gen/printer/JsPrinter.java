package org.flutterjs.gen.printer;

import com.github.javaparser.printer.DefaultPrettyPrinterVisitor;
import com.github.javaparser.printer.SourcePrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.Indentation;
import com.github.javaparser.printer.configuration.Indentation.IndentType;
import com.github.javaparser.printer.configuration.PrinterConfiguration;

/**
 * Indentation-aware text sink for generated JavaScript, backed by JavaParser's {@link SourcePrinter}.
 * <p>
 * {@code SourcePrinter} indents only at the start of a line, so text containing newlines
 * (nested lambda bodies, pretty-printed widget records) must go through {@link #printLines(String)},
 * which re-indents every line at the current level.
 */
public final class JsPrinter {

    public static final int INDENT_SIZE = 2;

    private final SourcePrinter printer;

    public JsPrinter() {
        this.printer = new Sink(configuration()).printer();
    }

    /**
     * The pretty-printer visitor owns the configured {@link SourcePrinter}; only its printer is used.
     */
    private static final class Sink extends DefaultPrettyPrinterVisitor {

        Sink(PrinterConfiguration configuration) {
            super(configuration);
        }

        SourcePrinter printer() {
            return printer;
        }
    }

    private static PrinterConfiguration configuration() {
        PrinterConfiguration config = new DefaultPrinterConfiguration();
        config.addOption(new DefaultConfigurationOption(ConfigOption.INDENTATION,
                new Indentation(IndentType.SPACES, INDENT_SIZE)));
        config.addOption(new DefaultConfigurationOption(ConfigOption.END_OF_LINE_CHARACTER, "\n"));
        return config;
    }

    public JsPrinter indent() {
        printer.indent();
        return this;
    }

    public JsPrinter unindent() {
        printer.unindent();
        return this;
    }

    public JsPrinter print(String text) {
        printer.print(text);
        return this;
    }

    public JsPrinter println(String text) {
        printer.println(text);
        return this;
    }

    public JsPrinter println() {
        printer.println();
        return this;
    }

    /**
     * Prints multi-line text, indenting each line at the current level. The last line is left
     * open so that callers can append a terminator such as {@code ;}.
     */
    public JsPrinter printLines(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                printer.println();
            }
            if (!lines[i].isEmpty()) {
                printer.print(lines[i]);
            }
        }
        return this;
    }

    /**
     * {@link #printLines(String)} followed by a line break.
     */
    public JsPrinter printlnLines(String text) {
        printLines(text);
        printer.println();
        return this;
    }

    @Override
    public String toString() {
        return printer.toString();
    }
}
