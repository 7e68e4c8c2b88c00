package org.flutterjs.gen.imports;

public enum SymbolKind {
    CLASS,
    FUNCTION,
    VARIABLE,
    ENUM,
    /** Type alias; has no runtime representation and is never imported or re-exported. */
    TYPEDEF
}
