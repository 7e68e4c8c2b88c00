package org.flutterjs.gen.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry entry for one framework widget.
 *
 * @param runtimeClass class name in the target runtime
 * @param module       runtime module exporting {@code runtimeClass}
 * @param positional   property names that positional constructor arguments bind to, in order
 * @param sinceVersion framework version the stability tag refers to
 * @param limitations  known gaps reported with beta/alpha warnings
 */
public record WidgetSpec(String name,
                         String runtimeClass,
                         String module,
                         StabilityTag stability,
                         String sinceVersion,
                         String limitations,
                         List<String> positional,
                         Map<String, PropertySpec> properties) {

    public WidgetSpec {
        positional = positional == null ? List.of() : List.copyOf(positional);
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Optional<PropertySpec> property(String propertyName) {
        return Optional.ofNullable(properties.get(propertyName));
    }

    public List<PropertySpec> requiredProperties() {
        return properties.values().stream().filter(PropertySpec::required).toList();
    }
}
