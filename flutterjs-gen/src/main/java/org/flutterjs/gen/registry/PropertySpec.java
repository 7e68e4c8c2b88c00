package org.flutterjs.gen.registry;

/**
 * @param replacement the property to use instead when {@code deprecated} is set
 */
public record PropertySpec(String name, PropertyType type, boolean required, boolean deprecated, String replacement) {

    public static PropertySpec optional(String name, PropertyType type) {
        return new PropertySpec(name, type, false, false, null);
    }

    public static PropertySpec required(String name, PropertyType type) {
        return new PropertySpec(name, type, true, false, null);
    }

    public static PropertySpec deprecated(String name, PropertyType type, String replacement) {
        return new PropertySpec(name, type, false, true, replacement);
    }
}
