package org.flutterjs.ir.decl;

/**
 * @param disposeMethod the method that releases the field's resource ({@code dispose}, {@code cancel}),
 *                      or {@code null} when the field holds no resource
 */
public record StateFieldInfo(String name, FieldRole role, String disposeMethod) {

    public boolean isDisposable() {
        return disposeMethod != null;
    }
}
