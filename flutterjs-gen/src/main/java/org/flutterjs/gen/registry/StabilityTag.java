package org.flutterjs.gen.registry;

public enum StabilityTag {
    STABLE,
    BETA,
    ALPHA,
    DEV,
    DEPRECATED
}
