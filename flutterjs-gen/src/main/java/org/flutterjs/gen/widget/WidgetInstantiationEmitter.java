package org.flutterjs.gen.widget;

import org.flutterjs.gen.WidgetValidationException;
import org.flutterjs.gen.config.Target;
import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.gen.printer.JsNames;
import org.flutterjs.gen.registry.PropertySpec;
import org.flutterjs.gen.registry.WidgetSpec;
import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.expr.NamedArgument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Emits widget instantiations as {@code new RuntimeClass({ ... })} after checking them against
 * the widget registry: stability tag first, then each supplied property, then the required ones.
 * <p>
 * Violations are diagnostics. In strict mode deprecated and dev widgets and missing required
 * properties throw {@link WidgetValidationException} instead.
 */
public final class WidgetInstantiationEmitter {

    private static final Logger log = LoggerFactory.getLogger(WidgetInstantiationEmitter.class);

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;
    private final PropertyConverters converters;

    public WidgetInstantiationEmitter(EmitContext ctx, ExpressionEmitter expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
        this.converters = new PropertyConverters(ctx, expressions);
    }

    public PropertyConverters converters() {
        return converters;
    }

    public String emit(String widgetName, List<Expression> positional, List<NamedArgument> named) {
        if (ctx.options().target() == Target.NODE) {
            ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.WIDGET_ON_NODE_TARGET,
                            "Widget '" + widgetName + "' cannot be rendered on the NODE target")
                    .withNode(widgetName)
                    .withSuggestion("Generate this file for the WEB target"));
        }
        Optional<WidgetSpec> spec = ctx.registry().lookup(widgetName);
        if (spec.isEmpty()) {
            return customWidget(widgetName, positional, named);
        }
        WidgetSpec widget = spec.get();
        checkStability(widget);

        Map<String, String> properties = new LinkedHashMap<>();
        for (int i = 0; i < positional.size(); i++) {
            if (i >= widget.positional().size()) {
                ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.UNKNOWN_PROPERTY,
                                "'" + widgetName + "' takes " + widget.positional().size() + " positional argument(s), got " + positional.size())
                        .withNode(widgetName));
                break;
            }
            String propertyName = widget.positional().get(i);
            properties.put(propertyName, convert(widget, propertyName, positional.get(i)));
        }
        for (NamedArgument argument : named) {
            properties.put(argument.name(), convert(widget, argument.name(), argument.value()));
        }
        for (PropertySpec required : widget.requiredProperties()) {
            if (!properties.containsKey(required.name())) {
                missingRequired(widget, required);
            }
        }
        log.debug("Emitting widget {} as {}", widgetName, widget.runtimeClass());
        return render(widget.runtimeClass(), properties);
    }

    private String customWidget(String widgetName, List<Expression> positional, List<NamedArgument> named) {
        ctx.diagnostics().add(Diagnostic.of(Severity.INFO, DiagnosticCode.CUSTOM_WIDGET,
                        "'" + widgetName + "' is not in the widget registry; treated as a custom widget")
                .withNode(widgetName));
        if (!positional.isEmpty()) {
            return "new " + widgetName + "(" + expressions.arguments(positional, named) + ")";
        }
        Map<String, String> properties = new LinkedHashMap<>();
        for (NamedArgument argument : named) {
            properties.put(argument.name(), expressions.emit(argument.value()));
        }
        return render(widgetName, properties);
    }

    private void checkStability(WidgetSpec widget) {
        String name = widget.name();
        switch (widget.stability()) {
            case DEPRECATED -> {
                String message = "Widget '" + name + "' is deprecated";
                if (ctx.options().strictMode()) {
                    throw new WidgetValidationException(message, name, null);
                }
                ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.DEPRECATED_WIDGET, message)
                        .withNode(name)
                        .withSuggestion("Replace with " + widget.runtimeClass()));
            }
            case BETA, ALPHA -> ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.UNSTABLE_WIDGET,
                            "Widget '" + name + "' is " + widget.stability().name().toLowerCase()
                                    + (widget.sinceVersion() == null ? "" : " since " + widget.sinceVersion())
                                    + (widget.limitations() == null ? "" : ": " + widget.limitations()))
                    .withNode(name));
            case DEV -> {
                String message = "Widget '" + name + "' is a development-only widget";
                if (ctx.options().strictMode()) {
                    throw new WidgetValidationException(message, name, null);
                }
                ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.DEV_WIDGET, message)
                        .withNode(name)
                        .withSuggestion("Remove '" + name + "' before shipping"));
            }
            default -> {
            }
        }
    }

    private String convert(WidgetSpec widget, String propertyName, Expression value) {
        Optional<PropertySpec> property = widget.property(propertyName);
        if (property.isEmpty()) {
            if (ctx.options().strictPropertyValidation()) {
                ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.UNKNOWN_PROPERTY,
                                "Unknown property '" + propertyName + "' on '" + widget.name() + "'")
                        .withNode(widget.name() + "." + propertyName));
            }
            return expressions.emit(value);
        }
        PropertySpec spec = property.get();
        if (spec.deprecated()) {
            ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.DEPRECATED_PROPERTY,
                            "Property '" + propertyName + "' of '" + widget.name() + "' is deprecated")
                    .withNode(widget.name() + "." + propertyName)
                    .withSuggestion(spec.replacement() == null ? null : "Use '" + spec.replacement() + "' instead"));
        }
        return converters.convert(spec.type(), value);
    }

    private void missingRequired(WidgetSpec widget, PropertySpec required) {
        String message = "Missing required property '" + required.name() + "' on '" + widget.name() + "'";
        if (ctx.options().strictMode()) {
            throw new WidgetValidationException(message, widget.name(), required.name());
        }
        ctx.diagnostics().add(Diagnostic.of(Severity.ERROR, DiagnosticCode.MISSING_REQUIRED_PROPERTY, message)
                .withNode(widget.name())
                .withSuggestion("Pass '" + required.name() + "'"));
    }

    private String render(String runtimeClass, Map<String, String> properties) {
        if (properties.isEmpty()) {
            return "new " + runtimeClass + "({})";
        }
        StringBuilder sb = new StringBuilder("new ").append(runtimeClass).append("({");
        if (!ctx.options().prettyPrint()) {
            sb.append(' ');
            String separator = "";
            for (Map.Entry<String, String> p : properties.entrySet()) {
                sb.append(separator).append(JsNames.propertyKey(p.getKey())).append(": ").append(p.getValue());
                separator = ", ";
            }
            return sb.append(" })").toString();
        }
        sb.append('\n');
        for (Map.Entry<String, String> p : properties.entrySet()) {
            String value = p.getValue().replace("\n", "\n  ");
            sb.append("  ").append(JsNames.propertyKey(p.getKey())).append(": ").append(value).append(",\n");
        }
        return sb.append("})").toString();
    }
}
