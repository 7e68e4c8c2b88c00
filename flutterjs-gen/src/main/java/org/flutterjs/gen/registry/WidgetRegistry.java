package org.flutterjs.gen.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of known widgets. Built once before generation and shared by concurrent runs.
 */
public final class WidgetRegistry {

    private static final WidgetRegistry STANDARD = StandardWidgets.register(builder()).build();

    private final Map<String, WidgetSpec> widgets;

    private WidgetRegistry(Map<String, WidgetSpec> widgets) {
        this.widgets = Map.copyOf(widgets);
    }

    /**
     * The built-in table of framework widgets.
     */
    public static WidgetRegistry standard() {
        return STANDARD;
    }

    public static WidgetRegistry empty() {
        return new WidgetRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Case-sensitive lookup.
     */
    public Optional<WidgetSpec> lookup(String widgetName) {
        return Optional.ofNullable(widgets.get(widgetName));
    }

    public boolean isWidget(String name) {
        return widgets.containsKey(name);
    }

    public Collection<WidgetSpec> all() {
        return widgets.values();
    }

    public int size() {
        return widgets.size();
    }

    public static final class Builder {

        private final Map<String, WidgetSpec> widgets = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(WidgetSpec spec) {
            widgets.put(spec.name(), spec);
            return this;
        }

        public Builder addAll(WidgetRegistry other) {
            other.widgets.values().forEach(this::register);
            return this;
        }

        public WidgetBuilder widget(String name, String module) {
            return new WidgetBuilder(this, name, module);
        }

        public WidgetRegistry build() {
            return new WidgetRegistry(widgets);
        }
    }

    /**
     * Fluent definition of one {@link WidgetSpec}; every widget implicitly accepts {@code key}.
     */
    public static final class WidgetBuilder {

        private final Builder owner;
        private final String name;
        private final String module;
        private String runtimeClass;
        private StabilityTag stability = StabilityTag.STABLE;
        private String sinceVersion;
        private String limitations;
        private final List<String> positional = new ArrayList<>();
        private final Map<String, PropertySpec> properties = new LinkedHashMap<>();

        private WidgetBuilder(Builder owner, String name, String module) {
            this.owner = owner;
            this.name = name;
            this.module = module;
            this.runtimeClass = name;
            properties.put("key", PropertySpec.optional("key", PropertyType.ANY));
        }

        public WidgetBuilder runtimeClass(String runtimeClass) {
            this.runtimeClass = runtimeClass;
            return this;
        }

        public WidgetBuilder stability(StabilityTag stability, String sinceVersion, String limitations) {
            this.stability = stability;
            this.sinceVersion = sinceVersion;
            this.limitations = limitations;
            return this;
        }

        public WidgetBuilder positional(String propertyName) {
            positional.add(propertyName);
            return this;
        }

        public WidgetBuilder required(String propertyName, PropertyType type) {
            properties.put(propertyName, PropertySpec.required(propertyName, type));
            return this;
        }

        public WidgetBuilder optional(String propertyName, PropertyType type) {
            properties.put(propertyName, PropertySpec.optional(propertyName, type));
            return this;
        }

        public WidgetBuilder deprecated(String propertyName, PropertyType type, String replacement) {
            properties.put(propertyName, PropertySpec.deprecated(propertyName, type, replacement));
            return this;
        }

        public Builder register() {
            return owner.register(new WidgetSpec(name, runtimeClass, module, stability, sinceVersion,
                    limitations, positional, properties));
        }
    }
}
