package com.verity.dataquality.runtime.evaluation;

import com.verity.dataquality.runtime.config.EnvironmentReader;
import com.verity.dataquality.runtime.operators.PatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Configuration of a validation run.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * VALIDATION_PATTERN_CACHE_SIZE=5000
 * VALIDATION_PATTERN_STEP_LIMIT=250000
 * VALIDATION_DETECT_DUPLICATES=false
 * VALIDATION_DETECT_FORMATTING=true
 * </pre>
 * Environment values are applied when a builder is created; explicit builder
 * calls take precedence over them.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ValidationConfig config = ValidationConfig.builder()
 *     .patternStepLimit(100_000)
 *     .detectFormatting(false)
 *     .build();
 * ValidationEngine engine = new ValidationEngine(tracer, config);
 * }</pre>
 */
public final class ValidationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ValidationConfig.class);

    static final String ENV_PATTERN_CACHE_SIZE = "VALIDATION_PATTERN_CACHE_SIZE";
    static final String ENV_PATTERN_STEP_LIMIT = "VALIDATION_PATTERN_STEP_LIMIT";
    static final String ENV_DETECT_DUPLICATES = "VALIDATION_DETECT_DUPLICATES";
    static final String ENV_DETECT_FORMATTING = "VALIDATION_DETECT_FORMATTING";

    private final long patternCacheSize;
    private final long patternStepLimit;
    private final boolean detectDuplicates;
    private final boolean detectFormatting;

    private ValidationConfig(Builder builder) {
        this.patternCacheSize = builder.patternCacheSize;
        this.patternStepLimit = builder.patternStepLimit;
        this.detectDuplicates = builder.detectDuplicates;
        this.detectFormatting = builder.detectFormatting;
        validate();
    }

    public static ValidationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(System::getenv);
    }

    /**
     * Builder reading overrides from {@code environment} instead of the process environment.
     */
    static Builder builder(Function<String, String> environment) {
        return new Builder(environment);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(key -> null);
        builder.patternCacheSize = this.patternCacheSize;
        builder.patternStepLimit = this.patternStepLimit;
        builder.detectDuplicates = this.detectDuplicates;
        builder.detectFormatting = this.detectFormatting;
        return builder;
    }

    public long patternCacheSize() {
        return patternCacheSize;
    }

    public long patternStepLimit() {
        return patternStepLimit;
    }

    public boolean detectDuplicates() {
        return detectDuplicates;
    }

    public boolean detectFormatting() {
        return detectFormatting;
    }

    private void validate() {
        if (patternCacheSize <= 0) {
            throw new IllegalArgumentException("patternCacheSize must be positive: " + patternCacheSize);
        }
        if (patternStepLimit <= 0) {
            throw new IllegalArgumentException("patternStepLimit must be positive: " + patternStepLimit);
        }
    }

    @Override
    public String toString() {
        return "ValidationConfig{" +
            "patternCacheSize=" + patternCacheSize +
            ", patternStepLimit=" + patternStepLimit +
            ", detectDuplicates=" + detectDuplicates +
            ", detectFormatting=" + detectFormatting +
            '}';
    }

    public static final class Builder {

        private long patternCacheSize = PatternMatcher.DEFAULT_CACHE_SIZE;
        private long patternStepLimit = PatternMatcher.DEFAULT_STEP_LIMIT;
        private boolean detectDuplicates = true;
        private boolean detectFormatting = true;

        private Builder(Function<String, String> environment) {
            EnvironmentReader env = new EnvironmentReader(environment, logger);
            env.getLong(ENV_PATTERN_CACHE_SIZE).ifPresent(val -> this.patternCacheSize = val);
            env.getLong(ENV_PATTERN_STEP_LIMIT).ifPresent(val -> this.patternStepLimit = val);
            env.getBoolean(ENV_DETECT_DUPLICATES).ifPresent(val -> this.detectDuplicates = val);
            env.getBoolean(ENV_DETECT_FORMATTING).ifPresent(val -> this.detectFormatting = val);
        }

        public Builder patternCacheSize(long size) {
            this.patternCacheSize = size;
            return this;
        }

        public Builder patternStepLimit(long limit) {
            this.patternStepLimit = limit;
            return this;
        }

        public Builder detectDuplicates(boolean enable) {
            this.detectDuplicates = enable;
            return this;
        }

        public Builder detectFormatting(boolean enable) {
            this.detectFormatting = enable;
            return this;
        }

        public ValidationConfig build() {
            return new ValidationConfig(this);
        }
    }
}
