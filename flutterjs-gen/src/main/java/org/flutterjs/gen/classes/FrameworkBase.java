package org.flutterjs.gen.classes;

import java.util.Arrays;
import java.util.Optional;

/**
 * Base classes provided by the runtime, recognized by their declared name.
 */
public enum FrameworkBase {

    STATEFUL_WIDGET("StatefulWidget"),
    STATELESS_WIDGET("StatelessWidget"),
    STATE("State"),
    CHANGE_NOTIFIER("ChangeNotifier");

    /** Base of a superclass-less class that declares {@code build}. */
    public static final String GENERIC_WIDGET = "Widget";

    private final String className;

    FrameworkBase(String className) {
        this.className = className;
    }

    public String className() {
        return className;
    }

    public static Optional<FrameworkBase> of(String name) {
        return Arrays.stream(values()).filter(b -> b.className.equals(name)).findFirst();
    }

    public boolean isWidget() {
        return this == STATEFUL_WIDGET || this == STATELESS_WIDGET;
    }
}
