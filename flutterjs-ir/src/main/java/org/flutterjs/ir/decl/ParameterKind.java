package org.flutterjs.ir.decl;

public enum ParameterKind {
    POSITIONAL,
    OPTIONAL_POSITIONAL,
    NAMED
}
