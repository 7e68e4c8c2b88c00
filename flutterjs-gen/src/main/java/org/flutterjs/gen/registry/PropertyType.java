package org.flutterjs.gen.registry;

/**
 * Declared type of a widget property; selects the value converter.
 */
public enum PropertyType {
    COLOR,
    EDGE_INSETS,
    ALIGNMENT,
    TEXT_STYLE,
    DURATION,
    CURVE,
    CALLBACK,
    WIDGET,
    WIDGET_LIST,
    STRING,
    NUMBER,
    BOOL,
    ANY
}
