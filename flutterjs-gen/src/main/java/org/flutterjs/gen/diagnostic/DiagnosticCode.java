package org.flutterjs.gen.diagnostic;

public enum DiagnosticCode {
    // analysis
    EMPTY_PROGRAM_UNIT,
    GENERATION_FAILED,
    INHERITANCE_CYCLE,

    // expressions and statements
    UNRESOLVED_IDENTIFIER,
    UNSUPPORTED_EXPRESSION,
    UNSUPPORTED_STATEMENT,
    AWAIT_OUTSIDE_ASYNC,

    // widgets
    CUSTOM_WIDGET,
    DEPRECATED_WIDGET,
    UNSTABLE_WIDGET,
    DEV_WIDGET,
    UNKNOWN_PROPERTY,
    DEPRECATED_PROPERTY,
    MISSING_REQUIRED_PROPERTY,
    PROPERTY_CONVERSION,
    WIDGET_ON_NODE_TARGET,

    // classes
    CLASS_GENERATION_FAILED,
    METHOD_GENERATION_FAILED,
    ACCESSOR_MERGE_FAILED,
    MISSING_BUILD_METHOD,
    STATE_NAMING,
    STATE_MISSING_SUPERCLASS,
    STATE_CLASS_NOT_FOUND,

    // imports and exports
    UNRESOLVED_IMPORT,
    CIRCULAR_IMPORT,
    EXPORT_HIDE_DROPPED,

    // validation and optimization
    VALIDATION,
    INVALID_OPTIMIZATION_LEVEL,
    OPTIMIZATION_FAILED
}
