package org.flutterjs.gen.widget;

import org.flutterjs.gen.diagnostic.Diagnostic;
import org.flutterjs.gen.diagnostic.DiagnosticCode;
import org.flutterjs.gen.diagnostic.Severity;
import org.flutterjs.gen.emit.EmitContext;
import org.flutterjs.gen.emit.ExpressionEmitter;
import org.flutterjs.gen.printer.JsLiterals;
import org.flutterjs.gen.registry.PropertyType;
import org.flutterjs.ir.expr.Expression;
import org.flutterjs.ir.expr.IdentifierExpr;
import org.flutterjs.ir.expr.InstanceCreationExpr;
import org.flutterjs.ir.expr.LambdaExpr;
import org.flutterjs.ir.expr.LiteralExpr;
import org.flutterjs.ir.expr.LiteralKind;
import org.flutterjs.ir.expr.MethodCallExpr;
import org.flutterjs.ir.expr.NamedArgument;
import org.flutterjs.ir.expr.PropertyAccessExpr;
import org.flutterjs.ir.expr.ThisExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts widget property values to the runtime's representation, keyed by the property's
 * declared {@link PropertyType}. Values a converter does not recognize pass through the
 * expression emitter unchanged.
 */
public final class PropertyConverters {

    private static final Map<String, String> MATERIAL_COLORS = Map.ofEntries(
            Map.entry("red", "#F44336"),
            Map.entry("pink", "#E91E63"),
            Map.entry("purple", "#9C27B0"),
            Map.entry("deeppurple", "#673AB7"),
            Map.entry("indigo", "#3F51B5"),
            Map.entry("blue", "#2196F3"),
            Map.entry("lightblue", "#03A9F4"),
            Map.entry("cyan", "#00BCD4"),
            Map.entry("teal", "#009688"),
            Map.entry("green", "#4CAF50"),
            Map.entry("lightgreen", "#8BC34A"),
            Map.entry("lime", "#CDDC39"),
            Map.entry("yellow", "#FFEB3B"),
            Map.entry("amber", "#FFC107"),
            Map.entry("orange", "#FF9800"),
            Map.entry("deeporange", "#FF5722"),
            Map.entry("brown", "#795548"),
            Map.entry("grey", "#9E9E9E"),
            Map.entry("bluegrey", "#607D8B"),
            Map.entry("black", "#000000"),
            Map.entry("white", "#FFFFFF"),
            Map.entry("transparent", "#00000000"));

    private static final Map<String, String> ALIGNMENTS = Map.of(
            "topLeft", "flex-start flex-start",
            "topCenter", "flex-start center",
            "topRight", "flex-start flex-end",
            "centerLeft", "center flex-start",
            "center", "center center",
            "centerRight", "center flex-end",
            "bottomLeft", "flex-end flex-start",
            "bottomCenter", "flex-end center",
            "bottomRight", "flex-end flex-end");

    private static final Map<String, String> CURVES = Map.of(
            "linear", "linear",
            "easeIn", "cubic-bezier(0.4, 0.0, 1.0, 1.0)",
            "easeOut", "cubic-bezier(0.0, 0.0, 0.2, 1.0)",
            "easeInOut", "cubic-bezier(0.4, 0.0, 0.2, 1.0)",
            "fastOutSlowIn", "cubic-bezier(0.4, 0.0, 0.2, 1.0)",
            "bounceIn", "cubic-bezier(0.675, 0.19, 0.985, 0.16)",
            "bounceOut", "cubic-bezier(0.015, 0.84, 0.33, 1.0)",
            "elasticIn", "cubic-bezier(0.17, 0.67, 0.83, 0.67)",
            "elasticOut", "cubic-bezier(0.17, 0.67, 0.83, 0.67)");

    private static final Map<String, Long> DURATION_UNITS = Map.of(
            "days", 86_400_000L,
            "hours", 3_600_000L,
            "minutes", 60_000L,
            "seconds", 1_000L,
            "milliseconds", 1L);

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;

    /**
     * A constructor or static factory call, whichever IR shape it arrived in.
     */
    private record Construction(String type, String name, List<Expression> positional, List<NamedArgument> named) {

        Optional<Expression> named(String argument) {
            return named.stream().filter(a -> a.name().equals(argument)).map(NamedArgument::value).findFirst();
        }
    }

    public PropertyConverters(EmitContext ctx, ExpressionEmitter expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
    }

    public String convert(PropertyType type, Expression value) {
        Optional<String> converted = switch (type) {
            case COLOR -> color(value);
            case EDGE_INSETS -> edgeInsets(value);
            case ALIGNMENT -> constant(value, "Alignment", ALIGNMENTS);
            case TEXT_STYLE -> textStyle(value);
            case DURATION -> duration(value);
            case CURVE -> constant(value, "Curves", CURVES);
            case CALLBACK -> callback(value);
            default -> Optional.empty();
        };
        return converted.orElseGet(() -> expressions.emit(value));
    }

    private static Optional<Construction> construction(Expression e) {
        if (e instanceof InstanceCreationExpr c) {
            return Optional.of(new Construction(c.type().name(), c.constructorName(), c.arguments(), c.namedArguments()));
        }
        if (e instanceof MethodCallExpr call) {
            if (call.isUnqualified()) {
                return Optional.of(new Construction(call.methodName(), null, call.arguments(), call.namedArguments()));
            }
            if (call.target() instanceof IdentifierExpr owner) {
                return Optional.of(new Construction(owner.name(), call.methodName(), call.arguments(), call.namedArguments()));
            }
        }
        return Optional.empty();
    }

    /**
     * {@code Owner.member} with {@code Owner} a bare identifier.
     */
    private static Optional<String> staticMember(Expression e, String owner) {
        if (e instanceof PropertyAccessExpr access
                && access.target() instanceof IdentifierExpr id
                && id.name().equals(owner)) {
            return Optional.of(access.propertyName());
        }
        return Optional.empty();
    }

    private static Optional<Long> intLiteral(Expression e) {
        if (e instanceof LiteralExpr l && l.kind() == LiteralKind.INT) {
            return Optional.of(((Number) l.value()).longValue());
        }
        return Optional.empty();
    }

    // ── Colors ───────────────────────────────────────────────────

    private Optional<String> color(Expression value) {
        Optional<String> material = staticMember(value, "Colors");
        if (material.isPresent()) {
            String hex = MATERIAL_COLORS.get(material.get().toLowerCase(Locale.ROOT));
            if (hex == null) {
                ctx.diagnostics().add(Diagnostic.of(Severity.WARNING, DiagnosticCode.PROPERTY_CONVERSION,
                                "Unknown material color 'Colors." + material.get() + "'; using #000000")
                        .withSuggestion("Use a color value such as Color(0xFF2196F3)"));
                hex = "#000000";
            }
            return Optional.of(JsLiterals.quote(hex));
        }
        Optional<Long> literal = intLiteral(value);
        if (literal.isPresent()) {
            return Optional.of(JsLiterals.quote(argb(literal.get())));
        }
        Optional<Construction> c = construction(value);
        if (c.isEmpty() || !c.get().type().equals("Color")) {
            return Optional.empty();
        }
        Construction color = c.get();
        if (color.name() == null && color.positional().size() == 1) {
            return intLiteral(color.positional().get(0)).map(v -> JsLiterals.quote(argb(v)));
        }
        if ("fromARGB".equals(color.name()) && color.positional().size() == 4) {
            long[] channels = new long[4];
            for (int i = 0; i < 4; i++) {
                Optional<Long> channel = intLiteral(color.positional().get(i));
                if (channel.isEmpty()) {
                    return Optional.empty();
                }
                channels[i] = channel.get() & 0xFF;
            }
            return Optional.of(JsLiterals.quote(argb((channels[0] << 24) | (channels[1] << 16) | (channels[2] << 8) | channels[3])));
        }
        if ("fromRGBO".equals(color.name()) && color.positional().size() == 4) {
            List<String> parts = new ArrayList<>();
            for (Expression e : color.positional()) {
                parts.add(expressions.emit(e));
            }
            return Optional.of("`rgba(" + String.join(", ", parts.stream().map(p -> "${" + p + "}").toList()) + ")`");
        }
        return Optional.empty();
    }

    static String argb(long value) {
        return "#" + String.format("%08X", value & 0xFFFFFFFFL);
    }

    // ── Layout ───────────────────────────────────────────────────

    private Optional<String> edgeInsets(Expression value) {
        if (staticMember(value, "EdgeInsets").filter("zero"::equals).isPresent()) {
            return Optional.of(insets("0", "0", "0", "0"));
        }
        Optional<Construction> c = construction(value);
        if (c.isEmpty() || !c.get().type().equals("EdgeInsets") || c.get().name() == null) {
            return Optional.empty();
        }
        Construction insets = c.get();
        switch (insets.name()) {
            case "all" -> {
                if (insets.positional().size() != 1) {
                    return Optional.empty();
                }
                String v = expressions.emit(insets.positional().get(0));
                return Optional.of(insets(v, v, v, v));
            }
            case "symmetric" -> {
                String vertical = namedOrZero(insets, "vertical");
                String horizontal = namedOrZero(insets, "horizontal");
                return Optional.of(insets(vertical, horizontal, vertical, horizontal));
            }
            case "only" -> {
                return Optional.of(insets(namedOrZero(insets, "top"), namedOrZero(insets, "right"),
                        namedOrZero(insets, "bottom"), namedOrZero(insets, "left")));
            }
            case "fromLTRB" -> {
                if (insets.positional().size() != 4) {
                    return Optional.empty();
                }
                List<String> ltrb = insets.positional().stream().map(expressions::emit).toList();
                return Optional.of(insets(ltrb.get(1), ltrb.get(2), ltrb.get(3), ltrb.get(0)));
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private String namedOrZero(Construction c, String argument) {
        return c.named(argument).map(expressions::emit).orElse("0");
    }

    private static String insets(String top, String right, String bottom, String left) {
        return "new EdgeInsets({ top: " + top + ", right: " + right + ", bottom: " + bottom + ", left: " + left + " })";
    }

    private static Optional<String> constant(Expression value, String owner, Map<String, String> table) {
        return staticMember(value, owner).map(table::get).map(JsLiterals::quote);
    }

    // ── Text ─────────────────────────────────────────────────────

    private Optional<String> textStyle(Expression value) {
        Optional<Construction> c = construction(value);
        if (c.isEmpty() || !c.get().type().equals("TextStyle") || c.get().name() != null) {
            return Optional.empty();
        }
        List<String> properties = new ArrayList<>();
        for (NamedArgument argument : c.get().named()) {
            Expression v = argument.value();
            switch (argument.name()) {
                case "fontWeight" -> properties.add("fontWeight: " + fontWeight(v));
                case "fontStyle" -> properties.add("fontStyle: "
                        + staticMember(v, "FontStyle").map(JsLiterals::quote).orElseGet(() -> expressions.emit(v)));
                case "decoration" -> properties.add("textDecoration: " + decoration(v));
                case "height" -> properties.add("lineHeight: " + expressions.emit(v));
                case "color", "backgroundColor", "decorationColor" ->
                        properties.add(argument.name() + ": " + convert(PropertyType.COLOR, v));
                default -> properties.add(argument.name() + ": " + expressions.emit(v));
            }
        }
        return Optional.of(properties.isEmpty() ? "new TextStyle({})" : "new TextStyle({ " + String.join(", ", properties) + " })");
    }

    private String fontWeight(Expression v) {
        Optional<String> weight = staticMember(v, "FontWeight");
        if (weight.isEmpty()) {
            return expressions.emit(v);
        }
        String w = weight.get();
        if (w.equals("normal")) {
            return "400";
        }
        if (w.equals("bold")) {
            return "700";
        }
        if (w.matches("w[1-9]00")) {
            return w.substring(1);
        }
        return expressions.emit(v);
    }

    private String decoration(Expression v) {
        return staticMember(v, "TextDecoration")
                .map(d -> switch (d) {
                    case "lineThrough" -> "line-through";
                    case "underline", "overline", "none" -> d;
                    default -> null;
                })
                .map(JsLiterals::quote)
                .orElseGet(() -> expressions.emit(v));
    }

    // ── Animation ────────────────────────────────────────────────

    /**
     * Durations become milliseconds, folded to a constant when every component is a literal.
     */
    private Optional<String> duration(Expression value) {
        Optional<Construction> c = construction(value);
        if (c.isEmpty() || !c.get().type().equals("Duration") || c.get().name() != null) {
            return Optional.empty();
        }
        long constant = 0;
        List<String> terms = new ArrayList<>();
        for (NamedArgument argument : c.get().named()) {
            Long unit = DURATION_UNITS.get(argument.name());
            boolean micro = argument.name().equals("microseconds");
            if (unit == null && !micro) {
                return Optional.empty();
            }
            Optional<Long> literal = intLiteral(argument.value());
            if (literal.isPresent()) {
                constant += micro ? literal.get() / 1000 : literal.get() * unit;
            } else {
                String v = expressions.emit(argument.value());
                terms.add(micro ? "(" + v + ") / 1000" : unit == 1L ? "(" + v + ")" : "(" + v + ") * " + unit);
            }
        }
        if (terms.isEmpty()) {
            return Optional.of(Long.toString(constant));
        }
        if (constant != 0) {
            terms.add(Long.toString(constant));
        }
        return Optional.of("(" + String.join(" + ", terms) + ")");
    }

    // ── Callbacks ────────────────────────────────────────────────

    /**
     * A torn-off instance method keeps its receiver.
     */
    private Optional<String> callback(Expression value) {
        if (value instanceof LambdaExpr) {
            return Optional.empty();
        }
        String method = null;
        if (value instanceof IdentifierExpr id && ctx.isInstanceMethod(id.name())
                && ctx.scope().resolveVariable(id.name()).map(v -> v.isInstanceMember()).orElse(false)) {
            method = id.name();
        } else if (value instanceof PropertyAccessExpr access && access.target() instanceof ThisExpr
                && ctx.isInstanceMethod(access.propertyName())) {
            method = access.propertyName();
        }
        return Optional.ofNullable(method).map(m -> "this." + m + ".bind(this)");
    }
}
