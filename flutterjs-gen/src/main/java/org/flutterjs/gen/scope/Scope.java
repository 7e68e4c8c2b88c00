package org.flutterjs.gen.scope;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One lexical frame. A child holds a reference to its parent but does not own it; the parent
 * always outlives the children pushed onto it.
 */
public final class Scope {

    private final String name;
    private final Scope parent;
    private final Map<String, VariableInfo> variables = new LinkedHashMap<>();

    Scope(String name, Scope parent) {
        this.name = name;
        this.parent = parent;
    }

    public String name() {
        return name;
    }

    public Scope parent() {
        return parent;
    }

    void define(VariableInfo info) {
        variables.put(info.name(), info);
    }

    /**
     * Look up a name in this frame only.
     */
    public Optional<VariableInfo> local(String variableName) {
        return Optional.ofNullable(variables.get(variableName));
    }

    /**
     * Look up a name here, then recursively through the parent chain. The nearest declaration wins.
     */
    public Optional<VariableInfo> lookup(String variableName) {
        for (Scope s = this; s != null; s = s.parent) {
            VariableInfo info = s.variables.get(variableName);
            if (info != null) {
                return Optional.of(info);
            }
        }
        return Optional.empty();
    }

    public Collection<VariableInfo> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public int depth() {
        int depth = 0;
        for (Scope s = parent; s != null; s = s.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return parent == null ? name : parent + "/" + name;
    }
}
