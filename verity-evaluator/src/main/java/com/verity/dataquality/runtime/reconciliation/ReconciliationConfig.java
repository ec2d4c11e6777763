package com.verity.dataquality.runtime.reconciliation;

import com.verity.dataquality.api.model.PriorityLevel;
import com.verity.dataquality.api.model.ReconciliationStatus;
import com.verity.dataquality.runtime.config.EnvironmentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Classification policy for reconciliation results.
 *
 * <p>A run is a {@link ReconciliationStatus#MINOR_DIFFERENCES minor} difference
 * when all three counts are within the minor limits, a moderate one when all
 * are within the moderate limits, and major otherwise. Priority is based on
 * the total number of differences.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * RECON_MINOR_MAX_MISSING=5
 * RECON_MINOR_MAX_EXTRA=5
 * RECON_MINOR_MAX_MISMATCHES=10
 * RECON_MODERATE_MAX_MISSING=20
 * RECON_MODERATE_MAX_EXTRA=20
 * RECON_MODERATE_MAX_MISMATCHES=50
 * RECON_MEDIUM_PRIORITY_MAX_DIFFERENCES=10
 * </pre>
 */
public final class ReconciliationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationConfig.class);

    static final String ENV_MINOR_MAX_MISSING = "RECON_MINOR_MAX_MISSING";
    static final String ENV_MINOR_MAX_EXTRA = "RECON_MINOR_MAX_EXTRA";
    static final String ENV_MINOR_MAX_MISMATCHES = "RECON_MINOR_MAX_MISMATCHES";
    static final String ENV_MODERATE_MAX_MISSING = "RECON_MODERATE_MAX_MISSING";
    static final String ENV_MODERATE_MAX_EXTRA = "RECON_MODERATE_MAX_EXTRA";
    static final String ENV_MODERATE_MAX_MISMATCHES = "RECON_MODERATE_MAX_MISMATCHES";
    static final String ENV_MEDIUM_PRIORITY_MAX_DIFFERENCES = "RECON_MEDIUM_PRIORITY_MAX_DIFFERENCES";

    private final int minorMaxMissing;
    private final int minorMaxExtra;
    private final int minorMaxMismatches;
    private final int moderateMaxMissing;
    private final int moderateMaxExtra;
    private final int moderateMaxMismatches;
    private final int mediumPriorityMaxDifferences;

    private ReconciliationConfig(Builder builder) {
        this.minorMaxMissing = builder.minorMaxMissing;
        this.minorMaxExtra = builder.minorMaxExtra;
        this.minorMaxMismatches = builder.minorMaxMismatches;
        this.moderateMaxMissing = builder.moderateMaxMissing;
        this.moderateMaxExtra = builder.moderateMaxExtra;
        this.moderateMaxMismatches = builder.moderateMaxMismatches;
        this.mediumPriorityMaxDifferences = builder.mediumPriorityMaxDifferences;
        validate();
    }

    public static ReconciliationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(System::getenv);
    }

    static Builder builder(Function<String, String> environment) {
        return new Builder(environment);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(key -> null);
        builder.minorMaxMissing = this.minorMaxMissing;
        builder.minorMaxExtra = this.minorMaxExtra;
        builder.minorMaxMismatches = this.minorMaxMismatches;
        builder.moderateMaxMissing = this.moderateMaxMissing;
        builder.moderateMaxExtra = this.moderateMaxExtra;
        builder.moderateMaxMismatches = this.moderateMaxMismatches;
        builder.mediumPriorityMaxDifferences = this.mediumPriorityMaxDifferences;
        return builder;
    }

    public ReconciliationStatus classify(int missing, int extra, int mismatches) {
        if (missing == 0 && extra == 0 && mismatches == 0) {
            return ReconciliationStatus.PERFECT_MATCH;
        }
        if (missing <= minorMaxMissing && extra <= minorMaxExtra && mismatches <= minorMaxMismatches) {
            return ReconciliationStatus.MINOR_DIFFERENCES;
        }
        if (missing <= moderateMaxMissing && extra <= moderateMaxExtra && mismatches <= moderateMaxMismatches) {
            return ReconciliationStatus.MODERATE_DIFFERENCES;
        }
        return ReconciliationStatus.MAJOR_DIFFERENCES;
    }

    public PriorityLevel priority(int totalDifferences) {
        if (totalDifferences == 0) return PriorityLevel.LOW;
        if (totalDifferences <= mediumPriorityMaxDifferences) return PriorityLevel.MEDIUM;
        return PriorityLevel.HIGH;
    }

    public List<String> recommendations(int missing, int extra, int mismatches) {
        if (missing == 0 && extra == 0 && mismatches == 0) {
            return List.of("Files are identical - no action needed");
        }
        List<String> steps = new ArrayList<>(3);
        if (missing > 0) steps.add("Review missing records in destination");
        if (extra > 0) steps.add("Review extra records in destination");
        if (mismatches > 0) steps.add("Review data mismatches");
        return steps;
    }

    public int minorMaxMissing() {
        return minorMaxMissing;
    }

    public int minorMaxExtra() {
        return minorMaxExtra;
    }

    public int minorMaxMismatches() {
        return minorMaxMismatches;
    }

    public int moderateMaxMissing() {
        return moderateMaxMissing;
    }

    public int moderateMaxExtra() {
        return moderateMaxExtra;
    }

    public int moderateMaxMismatches() {
        return moderateMaxMismatches;
    }

    public int mediumPriorityMaxDifferences() {
        return mediumPriorityMaxDifferences;
    }

    private void validate() {
        if (minorMaxMissing < 0 || minorMaxExtra < 0 || minorMaxMismatches < 0
                || mediumPriorityMaxDifferences < 0) {
            throw new IllegalArgumentException("Thresholds must not be negative: " + this);
        }
        if (moderateMaxMissing < minorMaxMissing || moderateMaxExtra < minorMaxExtra
                || moderateMaxMismatches < minorMaxMismatches) {
            throw new IllegalArgumentException("Moderate thresholds must not be below minor ones: " + this);
        }
    }

    @Override
    public String toString() {
        return "ReconciliationConfig{" +
            "minor=" + minorMaxMissing + "/" + minorMaxExtra + "/" + minorMaxMismatches +
            ", moderate=" + moderateMaxMissing + "/" + moderateMaxExtra + "/" + moderateMaxMismatches +
            ", mediumPriorityMaxDifferences=" + mediumPriorityMaxDifferences +
            '}';
    }

    public static final class Builder {

        private int minorMaxMissing = 5;
        private int minorMaxExtra = 5;
        private int minorMaxMismatches = 10;
        private int moderateMaxMissing = 20;
        private int moderateMaxExtra = 20;
        private int moderateMaxMismatches = 50;
        private int mediumPriorityMaxDifferences = 10;

        private Builder(Function<String, String> environment) {
            EnvironmentReader env = new EnvironmentReader(environment, logger);
            env.getInt(ENV_MINOR_MAX_MISSING).ifPresent(val -> this.minorMaxMissing = val);
            env.getInt(ENV_MINOR_MAX_EXTRA).ifPresent(val -> this.minorMaxExtra = val);
            env.getInt(ENV_MINOR_MAX_MISMATCHES).ifPresent(val -> this.minorMaxMismatches = val);
            env.getInt(ENV_MODERATE_MAX_MISSING).ifPresent(val -> this.moderateMaxMissing = val);
            env.getInt(ENV_MODERATE_MAX_EXTRA).ifPresent(val -> this.moderateMaxExtra = val);
            env.getInt(ENV_MODERATE_MAX_MISMATCHES).ifPresent(val -> this.moderateMaxMismatches = val);
            env.getInt(ENV_MEDIUM_PRIORITY_MAX_DIFFERENCES).ifPresent(val -> this.mediumPriorityMaxDifferences = val);
        }

        public Builder minorLimits(int maxMissing, int maxExtra, int maxMismatches) {
            this.minorMaxMissing = maxMissing;
            this.minorMaxExtra = maxExtra;
            this.minorMaxMismatches = maxMismatches;
            return this;
        }

        public Builder moderateLimits(int maxMissing, int maxExtra, int maxMismatches) {
            this.moderateMaxMissing = maxMissing;
            this.moderateMaxExtra = maxExtra;
            this.moderateMaxMismatches = maxMismatches;
            return this;
        }

        public Builder mediumPriorityMaxDifferences(int max) {
            this.mediumPriorityMaxDifferences = max;
            return this;
        }

        public ReconciliationConfig build() {
            return new ReconciliationConfig(this);
        }
    }
}
