package org.flutterjs.gen.imports;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The enumerated list of import cycles the generator knows how to break. Anything not listed
 * here is reported as an unresolved cycle rather than patched.
 */
public final class CircularImportTable {

    private static final CircularImportTable STANDARD = builder()
            // path.dart exposes a top-level `context` getter; context.dart builds Style instances declared next to it
            .add("package:path/path.dart", "package:path/src/context.dart", "Context")
            .add("package:path/src/style.dart", "package:path/src/context.dart", "Context")
            // the platform interface picks its default instance; the method-channel implementation extends the interface
            .add("package:url_launcher_platform_interface/url_launcher_platform_interface.dart",
                 "package:url_launcher_platform_interface/method_channel_url_launcher.dart",
                 "MethodChannelUrlLauncher")
            .build();

    private final List<CircularImportBreak> entries;

    private CircularImportTable(List<CircularImportBreak> entries) {
        this.entries = List.copyOf(entries);
    }

    public static CircularImportTable standard() {
        return STANDARD;
    }

    public static CircularImportTable empty() {
        return new CircularImportTable(List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<CircularImportBreak> find(String importingLibrary, String providingLibrary, String symbol) {
        return entries.stream()
                .filter(e -> e.importingLibrary().equals(importingLibrary)
                        && e.providingLibrary().equals(providingLibrary)
                        && e.symbol().equals(symbol))
                .findFirst();
    }

    public List<CircularImportBreak> entries() {
        return entries;
    }

    public static final class Builder {

        private final List<CircularImportBreak> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String importingLibrary, String providingLibrary, String symbol) {
            entries.add(new CircularImportBreak(importingLibrary, providingLibrary, symbol, BreakStrategy.DEFERRED_GLOBAL));
            return this;
        }

        public CircularImportTable build() {
            return new CircularImportTable(entries);
        }
    }
}
