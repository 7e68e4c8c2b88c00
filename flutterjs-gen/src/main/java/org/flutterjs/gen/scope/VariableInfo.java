package org.flutterjs.gen.scope;

import org.flutterjs.ir.type.TypeRef;

/**
 * What the resolver knows about one declared name.
 *
 * @param owner the declaring class for members, {@code null} otherwise
 */
public record VariableInfo(String name,
                           TypeRef type,
                           boolean isField,
                           boolean isFinal,
                           boolean isParameter,
                           boolean isStatic,
                           String owner) {

    public static VariableInfo local(String name, TypeRef type, boolean isFinal) {
        return new VariableInfo(name, type, false, isFinal, false, false, null);
    }

    public static VariableInfo parameter(String name, TypeRef type) {
        return new VariableInfo(name, type, false, false, true, false, null);
    }

    public static VariableInfo field(String name, TypeRef type, boolean isFinal, String owner) {
        return new VariableInfo(name, type, true, isFinal, false, false, owner);
    }

    public static VariableInfo staticField(String name, TypeRef type, boolean isFinal, String owner) {
        return new VariableInfo(name, type, true, isFinal, false, true, owner);
    }

    /**
     * A unit-level declaration (class, function, top-level variable, enum) or an imported symbol.
     */
    public static VariableInfo global(String name) {
        return new VariableInfo(name, null, false, true, false, false, null);
    }

    public boolean isInstanceMember() {
        return isField && !isStatic;
    }
}
