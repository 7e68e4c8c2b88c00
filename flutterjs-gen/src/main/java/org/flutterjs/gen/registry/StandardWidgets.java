package org.flutterjs.gen.registry;

import static org.flutterjs.gen.registry.PropertyType.ALIGNMENT;
import static org.flutterjs.gen.registry.PropertyType.ANY;
import static org.flutterjs.gen.registry.PropertyType.BOOL;
import static org.flutterjs.gen.registry.PropertyType.CALLBACK;
import static org.flutterjs.gen.registry.PropertyType.COLOR;
import static org.flutterjs.gen.registry.PropertyType.CURVE;
import static org.flutterjs.gen.registry.PropertyType.DURATION;
import static org.flutterjs.gen.registry.PropertyType.EDGE_INSETS;
import static org.flutterjs.gen.registry.PropertyType.NUMBER;
import static org.flutterjs.gen.registry.PropertyType.STRING;
import static org.flutterjs.gen.registry.PropertyType.TEXT_STYLE;
import static org.flutterjs.gen.registry.PropertyType.WIDGET;
import static org.flutterjs.gen.registry.PropertyType.WIDGET_LIST;

/**
 * Static table of the framework widgets the runtime ships.
 */
final class StandardWidgets {

    static final String MATERIAL = "@flutterjs/material";

    private StandardWidgets() {
    }

    static WidgetRegistry.Builder register(WidgetRegistry.Builder registry) {
        // ── Text and layout ──
        registry.widget("Text", MATERIAL)
                .positional("data")
                .required("data", STRING)
                .optional("style", TEXT_STYLE)
                .optional("textAlign", ANY)
                .optional("maxLines", NUMBER)
                .optional("overflow", ANY)
                .optional("textScaler", ANY)
                .deprecated("textScaleFactor", NUMBER, "textScaler")
                .register();
        registry.widget("Container", MATERIAL)
                .optional("child", WIDGET)
                .optional("color", COLOR)
                .optional("padding", EDGE_INSETS)
                .optional("margin", EDGE_INSETS)
                .optional("alignment", ALIGNMENT)
                .optional("width", NUMBER)
                .optional("height", NUMBER)
                .optional("decoration", ANY)
                .optional("constraints", ANY)
                .register();
        for (String flex : new String[] {"Column", "Row"}) {
            registry.widget(flex, MATERIAL)
                    .optional("children", WIDGET_LIST)
                    .optional("mainAxisAlignment", ANY)
                    .optional("crossAxisAlignment", ANY)
                    .optional("mainAxisSize", ANY)
                    .register();
        }
        registry.widget("Center", MATERIAL)
                .optional("child", WIDGET)
                .optional("widthFactor", NUMBER)
                .optional("heightFactor", NUMBER)
                .register();
        registry.widget("Align", MATERIAL)
                .optional("alignment", ALIGNMENT)
                .optional("child", WIDGET)
                .register();
        registry.widget("Padding", MATERIAL)
                .required("padding", EDGE_INSETS)
                .optional("child", WIDGET)
                .register();
        registry.widget("SizedBox", MATERIAL)
                .optional("width", NUMBER)
                .optional("height", NUMBER)
                .optional("child", WIDGET)
                .register();
        registry.widget("Expanded", MATERIAL)
                .required("child", WIDGET)
                .optional("flex", NUMBER)
                .register();
        registry.widget("Stack", MATERIAL)
                .optional("children", WIDGET_LIST)
                .optional("alignment", ALIGNMENT)
                .optional("fit", ANY)
                .register();
        registry.widget("ListView", MATERIAL)
                .optional("children", WIDGET_LIST)
                .optional("padding", EDGE_INSETS)
                .optional("scrollDirection", ANY)
                .optional("shrinkWrap", BOOL)
                .register();

        // ── Material scaffolding ──
        registry.widget("MaterialApp", MATERIAL)
                .optional("home", WIDGET)
                .optional("title", STRING)
                .optional("theme", ANY)
                .optional("routes", ANY)
                .optional("debugShowCheckedModeBanner", BOOL)
                .register();
        registry.widget("Scaffold", MATERIAL)
                .optional("appBar", WIDGET)
                .optional("body", WIDGET)
                .optional("floatingActionButton", WIDGET)
                .optional("drawer", WIDGET)
                .optional("bottomNavigationBar", WIDGET)
                .optional("backgroundColor", COLOR)
                .register();
        registry.widget("AppBar", MATERIAL)
                .optional("title", WIDGET)
                .optional("leading", WIDGET)
                .optional("actions", WIDGET_LIST)
                .optional("backgroundColor", COLOR)
                .optional("elevation", NUMBER)
                .optional("centerTitle", BOOL)
                .register();
        registry.widget("Icon", MATERIAL)
                .positional("icon")
                .required("icon", ANY)
                .optional("size", NUMBER)
                .optional("color", COLOR)
                .register();

        // ── Buttons and input ──
        for (String button : new String[] {"ElevatedButton", "TextButton", "OutlinedButton"}) {
            registry.widget(button, MATERIAL)
                    .required("onPressed", CALLBACK)
                    .required("child", WIDGET)
                    .optional("onLongPress", CALLBACK)
                    .optional("style", ANY)
                    .register();
        }
        registry.widget("IconButton", MATERIAL)
                .required("icon", WIDGET)
                .required("onPressed", CALLBACK)
                .optional("tooltip", STRING)
                .optional("color", COLOR)
                .register();
        registry.widget("FloatingActionButton", MATERIAL)
                .required("onPressed", CALLBACK)
                .optional("child", WIDGET)
                .optional("tooltip", STRING)
                .optional("backgroundColor", COLOR)
                .register();
        registry.widget("GestureDetector", MATERIAL)
                .optional("child", WIDGET)
                .optional("onTap", CALLBACK)
                .optional("onDoubleTap", CALLBACK)
                .optional("onLongPress", CALLBACK)
                .register();

        // ── Animation ──
        registry.widget("AnimatedContainer", MATERIAL)
                .required("duration", DURATION)
                .optional("curve", CURVE)
                .optional("child", WIDGET)
                .optional("color", COLOR)
                .optional("padding", EDGE_INSETS)
                .optional("alignment", ALIGNMENT)
                .optional("width", NUMBER)
                .optional("height", NUMBER)
                .register();
        registry.widget("AnimatedOpacity", MATERIAL)
                .required("opacity", NUMBER)
                .required("duration", DURATION)
                .optional("curve", CURVE)
                .optional("child", WIDGET)
                .register();

        // ── Non-stable entries ──
        registry.widget("FlatButton", MATERIAL)
                .runtimeClass("TextButton")
                .stability(StabilityTag.DEPRECATED, "2.0", "Removed from the framework; use TextButton")
                .required("onPressed", CALLBACK)
                .optional("child", WIDGET)
                .deprecated("color", COLOR, "style")
                .register();
        registry.widget("RaisedButton", MATERIAL)
                .runtimeClass("ElevatedButton")
                .stability(StabilityTag.DEPRECATED, "2.0", "Removed from the framework; use ElevatedButton")
                .required("onPressed", CALLBACK)
                .optional("child", WIDGET)
                .deprecated("color", COLOR, "style")
                .register();
        registry.widget("SegmentedButton", MATERIAL)
                .stability(StabilityTag.BETA, "3.10", "Selection animations are not rendered")
                .required("segments", WIDGET_LIST)
                .required("selected", ANY)
                .optional("onSelectionChanged", CALLBACK)
                .register();
        registry.widget("SearchAnchor", MATERIAL)
                .stability(StabilityTag.ALPHA, "3.13", "Suggestion overlay positioning is approximate")
                .required("builder", CALLBACK)
                .required("suggestionsBuilder", CALLBACK)
                .register();
        registry.widget("WidgetInspector", MATERIAL)
                .stability(StabilityTag.DEV, "3.0", "Debug-only overlay")
                .required("child", WIDGET)
                .optional("selectButtonBuilder", CALLBACK)
                .register();
        return registry;
    }
}
