package com.purchasingpower.proofengine.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for the proof analysis pipeline.
 *
 * <p>Properties are loaded from the {@code app.proof} namespace in application.yml:
 * <pre>
 * app:
 *   proof:
 *     engine:
 *       enable-gap-analysis: true
 *       parallel-passes: true
 *     gap:
 *       strictness: standard
 *       max-leap-distance: 2
 *     inconsistency:
 *       max-pairwise-comparisons: 1000
 *     thresholds:
 *       reference-overlap: 0.5
 *       begging-overlap: 0.8
 *     budget:
 *       max-steps: 200000
 *       timeout: 5s
 * </pre>
 *
 * <p>The overlap and complexity thresholds are rough stand-ins for semantic
 * parsing. They are kept configurable rather than tuned.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.proof")
public class ProofAnalysisProperties {

    @Valid
    @NotNull
    private Engine engine = new Engine();

    @Valid
    @NotNull
    private Gap gap = new Gap();

    @Valid
    @NotNull
    private Inconsistency inconsistency = new Inconsistency();

    @Valid
    @NotNull
    private Thresholds thresholds = new Thresholds();

    @Valid
    @NotNull
    private Budget budget = new Budget();

    @Valid
    @NotNull
    private Executor executor = new Executor();

    public enum Strictness {
        LENIENT,
        STANDARD,
        STRICT
    }

    /**
     * Which passes the engine runs.
     */
    @Data
    public static class Engine {
        private boolean enableDecomposition = true;
        private boolean enableGapAnalysis = true;
        private boolean enableAssumptionTracking = true;
        private boolean enableInconsistencyDetection = true;
        private boolean enableCircularDetection = true;

        /**
         * Run the read-only passes concurrently on the analysis executor.
         */
        private boolean parallelPasses = true;
    }

    @Data
    public static class Gap {
        @NotNull
        private Strictness strictness = Strictness.STANDARD;
        private boolean checkDomainAssumptions = true;
        private boolean verifyInferenceRules = true;

        /**
         * Leap distance above which a justified step is still reported as a leap.
         */
        @Min(0)
        private int maxLeapDistance = 2;
    }

    @Data
    public static class Inconsistency {
        private boolean strictTyping = true;
        private boolean checkDomains = true;
        private boolean checkQuantifiers = true;

        /**
         * Pairwise contradiction search only looks at the first sqrt(n) statements.
         */
        @Min(1)
        private int maxPairwiseComparisons = 1000;
    }

    @Data
    public static class Thresholds {
        /**
         * Share of significant words a reference must share with a statement to resolve to it.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double referenceOverlap = 0.5;

        /**
         * Share of significant words above which a conclusion restates its premise.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double beggingOverlap = 0.8;

        /**
         * Overlap above which an earlier statement is suggested as a missing premise.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double suggestionOverlap = 0.3;

        @Min(1)
        private int impliedConnectionSharedWords = 2;

        @Min(1)
        private int leapComplexityDivisor = 10;
    }

    /**
     * Work limit applied around text parsing and pairwise loops.
     */
    @Data
    public static class Budget {
        @Min(1)
        private long maxSteps = 200_000;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 8;

        @Min(0)
        private int queueCapacity = 100;
    }
}
