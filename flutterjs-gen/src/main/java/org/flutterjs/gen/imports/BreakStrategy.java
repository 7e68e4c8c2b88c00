package org.flutterjs.gen.imports;

public enum BreakStrategy {
    /**
     * Replace the static import with a lazily evaluated property of a local {@code __deferred}
     * proxy that reads the symbol from {@code globalThis} on first use.
     */
    DEFERRED_GLOBAL
}
