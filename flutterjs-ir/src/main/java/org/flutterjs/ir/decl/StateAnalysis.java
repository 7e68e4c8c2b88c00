package org.flutterjs.ir.decl;

import java.util.List;
import java.util.Optional;

/**
 * Field classification of one {@code State} class, computed upstream of the generator.
 */
public record StateAnalysis(String stateClassName, List<StateFieldInfo> fields) {

    public StateAnalysis {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public Optional<StateFieldInfo> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
