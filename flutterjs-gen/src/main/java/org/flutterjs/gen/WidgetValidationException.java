package org.flutterjs.gen;

/**
 * Raised in strict mode when a widget instantiation violates its registry entry.
 */
public class WidgetValidationException extends CodeGenerationException {

    private final String widgetName;
    private final String propertyName;

    public WidgetValidationException(String message, String widgetName, String propertyName) {
        super(message, propertyName == null ? widgetName : widgetName + "." + propertyName);
        this.widgetName = widgetName;
        this.propertyName = propertyName;
    }

    public String getWidgetName() {
        return widgetName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
