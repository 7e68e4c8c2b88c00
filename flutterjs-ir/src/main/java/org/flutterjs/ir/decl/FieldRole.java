package org.flutterjs.ir.decl;

/**
 * Classification of a state field by the front end's flow analysis.
 */
public enum FieldRole {
    /** Read by {@code build} and mutated through {@code setState}. */
    REACTIVE,
    /** Private or cache state that never triggers a rebuild. */
    INTERNAL
}
