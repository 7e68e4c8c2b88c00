package org.flutterjs.gen.emit;

import org.flutterjs.ir.decl.Parameter;
import org.flutterjs.ir.expr.AsExpr;
import org.flutterjs.ir.type.TypeRef;

import java.util.Optional;

/**
 * Support functions that generated code may call. Each one used by a file is defined once in its
 * runtime-helper section. Constants are declared in function-name order, so iterating an
 * {@code EnumSet} yields the section's sorted order.
 */
public enum RuntimeHelper {

    LIST_CAST("listCast", """
            function listCast(list, expectedType) {
              return list.map(item => {
                if (!(item instanceof expectedType)) {
                  throw new TypeError(`Item must be of type ${expectedType.name}`);
                }
                return item;
              });
            }"""),

    MAP_CAST("mapCast", """
            function mapCast(map, expectedKeyType, expectedValueType) {
              const result = new Map();
              for (const [key, value] of map) {
                if (!(key instanceof expectedKeyType)) {
                  throw new TypeError(`Key must be of type ${expectedKeyType.name}`);
                }
                if (!(value instanceof expectedValueType)) {
                  throw new TypeError(`Value must be of type ${expectedValueType.name}`);
                }
                result.set(key, value);
              }
              return result;
            }"""),

    NULL_ASSERT("nullAssert", """
            function nullAssert(value) {
              if (value === null || value === undefined) {
                throw new Error("Null check operator '!' used on a null value");
              }
              return value;
            }"""),

    NULL_CHECK("nullCheck", """
            function nullCheck(value, name) {
              if (value === null || value === undefined) {
                throw new Error(`${name} cannot be null`);
              }
              return value;
            }"""),

    TYPE_ASSERTION("typeAssertion", """
            function typeAssertion(value, expectedType, variableName) {
              if (!(value instanceof expectedType)) {
                throw new TypeError(`${variableName} must be of type ${expectedType.name}`);
              }
              return value;
            }""");

    private final String functionName;
    private final String definition;

    RuntimeHelper(String functionName, String definition) {
        this.functionName = functionName;
        this.definition = definition;
    }

    public String functionName() {
        return functionName;
    }

    public String definition() {
        return definition;
    }

    /**
     * The helper that checks an {@code as} cast at runtime, empty when the cast is a passthrough.
     */
    public static Optional<RuntimeHelper> forCast(AsExpr cast) {
        TypeRef type = cast.type();
        if (type.nullable()) {
            return Optional.empty();
        }
        if (type.name().equals("List") && type.typeArguments().size() == 1
                && TypeTests.isClassType(type.typeArguments().get(0))) {
            return Optional.of(LIST_CAST);
        }
        if (type.name().equals("Map") && type.typeArguments().size() == 2
                && TypeTests.isClassType(type.typeArguments().get(0))
                && TypeTests.isClassType(type.typeArguments().get(1))) {
            return Optional.of(MAP_CAST);
        }
        return TypeTests.isClassType(type) ? Optional.of(TYPE_ASSERTION) : Optional.empty();
    }

    /**
     * A required named parameter of non-nullable type is checked on entry, since a destructured
     * record parameter cannot enforce presence.
     */
    public static boolean checksParameter(Parameter parameter) {
        return parameter.isNamed()
                && parameter.required()
                && parameter.defaultValue() == null
                && parameter.type() != null
                && !parameter.type().nullable()
                && !parameter.type().isDynamic();
    }
}
