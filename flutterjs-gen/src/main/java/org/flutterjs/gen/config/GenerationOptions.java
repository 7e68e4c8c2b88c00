package org.flutterjs.gen.config;

import org.flutterjs.gen.GenerationOptionsException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Immutable settings of one pipeline run.
 * <p>
 * {@link #defaults()} reads overrides from {@code flutterjs.gen.*} system properties, e.g.
 * {@code -Dflutterjs.gen.optimizationLevel=3} or {@code -Dflutterjs.gen.strict=true}.
 * The optimization level is stored as given; the pipeline clamps out-of-range values.
 */
public final class GenerationOptions {

    public static final String PROPERTY_PREFIX = "flutterjs.gen.";

    private final boolean validate;
    private final boolean optimize;
    private final int optimizationLevel;
    private final boolean dryRun;
    private final boolean prettyPrint;
    private final boolean strictMode;
    private final boolean strictPropertyValidation;
    private final boolean emitSuperCalls;
    private final boolean emitTypeComments;
    private final boolean invokeMain;
    private final boolean errorBanner;
    private final int minimumOutputSize;
    private final Target target;

    private GenerationOptions(Builder builder) {
        this.validate = builder.validate;
        this.optimize = builder.optimize;
        this.optimizationLevel = builder.optimizationLevel;
        this.dryRun = builder.dryRun;
        this.prettyPrint = builder.prettyPrint;
        this.strictMode = builder.strictMode;
        this.strictPropertyValidation = builder.strictPropertyValidation;
        this.emitSuperCalls = builder.emitSuperCalls;
        this.emitTypeComments = builder.emitTypeComments;
        this.invokeMain = builder.invokeMain;
        this.errorBanner = builder.errorBanner;
        this.minimumOutputSize = builder.minimumOutputSize;
        this.target = builder.target;
    }

    public static GenerationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .validate(validate)
                .optimize(optimize)
                .optimizationLevel(optimizationLevel)
                .dryRun(dryRun)
                .prettyPrint(prettyPrint)
                .strictMode(strictMode)
                .strictPropertyValidation(strictPropertyValidation)
                .emitSuperCalls(emitSuperCalls)
                .emitTypeComments(emitTypeComments)
                .invokeMain(invokeMain)
                .errorBanner(errorBanner)
                .minimumOutputSize(minimumOutputSize)
                .target(target);
    }

    public boolean validate() {
        return validate;
    }

    public boolean optimize() {
        return optimize;
    }

    public int optimizationLevel() {
        return optimizationLevel;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean prettyPrint() {
        return prettyPrint;
    }

    public boolean strictMode() {
        return strictMode;
    }

    public boolean strictPropertyValidation() {
        return strictPropertyValidation;
    }

    public boolean emitSuperCalls() {
        return emitSuperCalls;
    }

    public boolean emitTypeComments() {
        return emitTypeComments;
    }

    public boolean invokeMain() {
        return invokeMain;
    }

    public boolean errorBanner() {
        return errorBanner;
    }

    public int minimumOutputSize() {
        return minimumOutputSize;
    }

    public Target target() {
        return target;
    }

    @Override
    public String toString() {
        return "GenerationOptions{validate=" + validate + ", optimize=" + optimize
                + ", optimizationLevel=" + optimizationLevel + ", dryRun=" + dryRun
                + ", strictMode=" + strictMode + ", target=" + target + "}";
    }

    private static boolean property(String name, boolean defaultValue) {
        return Boolean.parseBoolean(System.getProperty(PROPERTY_PREFIX + name, Boolean.toString(defaultValue)));
    }

    private static int property(String name, int defaultValue) {
        String value = System.getProperty(PROPERTY_PREFIX + name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new GenerationOptionsException(name, "'" + value + "' is not an integer");
        }
    }

    private static Target targetProperty() {
        String value = System.getProperty(PROPERTY_PREFIX + "target");
        if (value == null) {
            return Target.WEB;
        }
        try {
            return Target.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GenerationOptionsException("target", "'" + value + "' is not one of " + Arrays.toString(Target.values()));
        }
    }

    public static final class Builder {

        private boolean validate = property("validate", true);
        private boolean optimize = property("optimize", false);
        private int optimizationLevel = property("optimizationLevel", 1);
        private boolean dryRun = property("dryRun", false);
        private boolean prettyPrint = property("prettyPrint", true);
        private boolean strictMode = property("strict", false);
        private boolean strictPropertyValidation = property("strictProperties", true);
        private boolean emitSuperCalls = true;
        private boolean emitTypeComments = property("typeComments", false);
        private boolean invokeMain = true;
        private boolean errorBanner = true;
        private int minimumOutputSize = property("minimumOutputSize", 50);
        private Target target = targetProperty();

        private Builder() {
        }

        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public Builder optimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        public Builder optimizationLevel(int optimizationLevel) {
            this.optimizationLevel = optimizationLevel;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder strictPropertyValidation(boolean strictPropertyValidation) {
            this.strictPropertyValidation = strictPropertyValidation;
            return this;
        }

        public Builder emitSuperCalls(boolean emitSuperCalls) {
            this.emitSuperCalls = emitSuperCalls;
            return this;
        }

        public Builder emitTypeComments(boolean emitTypeComments) {
            this.emitTypeComments = emitTypeComments;
            return this;
        }

        public Builder invokeMain(boolean invokeMain) {
            this.invokeMain = invokeMain;
            return this;
        }

        public Builder errorBanner(boolean errorBanner) {
            this.errorBanner = errorBanner;
            return this;
        }

        public Builder minimumOutputSize(int minimumOutputSize) {
            if (minimumOutputSize < 0) {
                throw new GenerationOptionsException("minimumOutputSize", "must not be negative");
            }
            this.minimumOutputSize = minimumOutputSize;
            return this;
        }

        public Builder target(Target target) {
            if (target == null) {
                throw new GenerationOptionsException("target", "must not be null");
            }
            this.target = target;
            return this;
        }

        public GenerationOptions build() {
            return new GenerationOptions(this);
        }
    }
}
