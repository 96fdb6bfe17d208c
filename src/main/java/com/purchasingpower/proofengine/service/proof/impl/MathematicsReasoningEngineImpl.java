package com.purchasingpower.proofengine.service.proof.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.AssumptionAnalysis;
import com.purchasingpower.proofengine.model.analysis.CircularReasoningResult;
import com.purchasingpower.proofengine.model.analysis.ConsistencyReport;
import com.purchasingpower.proofengine.model.analysis.EngineStats;
import com.purchasingpower.proofengine.model.analysis.FallacyWarning;
import com.purchasingpower.proofengine.model.analysis.GapAnalysisResult;
import com.purchasingpower.proofengine.model.analysis.InconsistencySummary;
import com.purchasingpower.proofengine.model.analysis.ProofAnalysisResult;
import com.purchasingpower.proofengine.model.analysis.ThoughtType;
import com.purchasingpower.proofengine.model.proof.Inconsistency;
import com.purchasingpower.proofengine.model.proof.InconsistencySeverity;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.ProofInput;
import com.purchasingpower.proofengine.service.proof.AnalysisBudget;
import com.purchasingpower.proofengine.service.proof.AssumptionTracker;
import com.purchasingpower.proofengine.service.proof.CircularReasoningDetector;
import com.purchasingpower.proofengine.service.proof.GapAnalyzer;
import com.purchasingpower.proofengine.service.proof.InconsistencyDetector;
import com.purchasingpower.proofengine.service.proof.MathematicsReasoningEngine;
import com.purchasingpower.proofengine.service.proof.ProofDecomposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Slf4j
@Service
public class MathematicsReasoningEngineImpl implements MathematicsReasoningEngine {

    static final String VERSION = "1.0.0";

    private final ProofAnalysisProperties properties;
    private final ProofDecomposer decomposer;
    private final GapAnalyzer gapAnalyzer;
    private final AssumptionTracker assumptionTracker;
    private final InconsistencyDetector inconsistencyDetector;
    private final CircularReasoningDetector circularDetector;
    private final Executor executor;

    public MathematicsReasoningEngineImpl(ProofAnalysisProperties properties,
                                          ProofDecomposer decomposer,
                                          GapAnalyzer gapAnalyzer,
                                          AssumptionTracker assumptionTracker,
                                          InconsistencyDetector inconsistencyDetector,
                                          CircularReasoningDetector circularDetector,
                                          @Qualifier("proofAnalysisExecutor") Executor executor) {
        this.properties = properties;
        this.decomposer = decomposer;
        this.gapAnalyzer = gapAnalyzer;
        this.assumptionTracker = assumptionTracker;
        this.inconsistencyDetector = inconsistencyDetector;
        this.circularDetector = circularDetector;
        this.executor = executor;
    }

    @Override
    public ProofAnalysisResult analyzeProof(ProofInput proof, String theorem) {
        Preconditions.checkNotNull(proof, "proof must not be null");
        ProofAnalysisProperties.Engine features = properties.getEngine();

        if (!features.isEnableDecomposition()) {
            return ProofAnalysisResult.builder()
                    .overallScore(0.0)
                    .recommendations(List.of("Unable to decompose proof. Please provide proof content."))
                    .valid(false)
                    .build();
        }

        long start = System.currentTimeMillis();
        AnalysisBudget budget = AnalysisBudget.from(properties.getBudget());
        ProofDecomposition decomposition = decomposer.decompose(proof, theorem, budget);
        AnalysisBudget gapBudget = budget.fork();
        AnalysisBudget inconsistencyBudget = budget.fork();
        AnalysisBudget circularBudget = budget.fork();

        CompletableFuture<GapAnalysisResult> gapFuture = features.isEnableGapAnalysis()
                ? submit(() -> gapAnalyzer.analyzeGaps(decomposition, gapBudget))
                : CompletableFuture.completedFuture(null);
        CompletableFuture<AssumptionAnalysis> assumptionFuture = features.isEnableAssumptionTracking()
                ? submit(() -> assumptionTracker.analyzeAssumptions(decomposition))
                : CompletableFuture.completedFuture(null);
        CompletableFuture<List<Inconsistency>> inconsistencyFuture = features.isEnableInconsistencyDetection()
                ? submit(() -> inconsistencyDetector.analyze(decomposition, inconsistencyBudget))
                : CompletableFuture.completedFuture(null);
        CompletableFuture<CircularReasoningResult> circularFuture = features.isEnableCircularDetection()
                ? submit(() -> circularDetector.detectCircularReasoning(decomposition, circularBudget))
                : CompletableFuture.completedFuture(null);

        GapAnalysisResult gapAnalysis = await(gapFuture);
        AssumptionAnalysis assumptionAnalysis = await(assumptionFuture);
        List<Inconsistency> inconsistencies = await(inconsistencyFuture);
        CircularReasoningResult circular = await(circularFuture);

        List<String> recommendations = new ArrayList<>();
        double score = decomposition.getCompleteness();

        if (gapAnalysis != null) {
            score *= gapAnalysis.getCompleteness();
            recommendations.addAll(gapAnalysis.getSuggestions());
        }

        if (assumptionAnalysis != null) {
            recommendations.addAll(assumptionTracker.getSuggestions(assumptionAnalysis));
            if (!assumptionAnalysis.getUnusedAssumptions().isEmpty()) {
                score *= 0.95;
            }
        }

        ConsistencyReport consistencyReport = null;
        if (inconsistencies != null || circular != null) {
            List<Inconsistency> found = inconsistencies != null ? inconsistencies : List.of();
            InconsistencySummary summary = inconsistencyDetector.getSummary(found);
            List<FallacyWarning> fallacies = inconsistencies != null
                    ? inconsistencyDetector.detectFallacies(decomposition)
                    : List.of();
            consistencyReport = buildReport(found, summary, circular, fallacies,
                    summary.isConsistent() ? score : score * 0.5);

            if (!consistencyReport.isConsistent()) {
                score *= 0.3;
                recommendations.add(0, consistencyReport.getSummary());
            }
        }

        List<String> stoppedIn = exhaustedStages(budget, gapBudget, inconsistencyBudget, circularBudget);
        if (!stoppedIn.isEmpty()) {
            recommendations.add(stoppedEarly(stoppedIn));
        }

        // A partial analysis cannot vouch for the proof
        double overallScore = Math.max(0, Math.min(1, score));
        boolean valid = stoppedIn.isEmpty()
                && (consistencyReport == null || consistencyReport.isConsistent())
                && overallScore > 0.5;

        log.info("Analyzed proof {} in {}ms: {} atoms, score {}, valid={}",
                decomposition.getId(), System.currentTimeMillis() - start, decomposition.getAtomCount(),
                String.format(Locale.ROOT, "%.3f", overallScore), valid);

        return ProofAnalysisResult.builder()
                .decomposition(decomposition)
                .consistencyReport(consistencyReport)
                .gapAnalysis(gapAnalysis)
                .assumptionAnalysis(assumptionAnalysis)
                .overallScore(overallScore)
                .recommendations(deduplicate(recommendations))
                .valid(valid)
                .build();
    }

    @Override
    public ProofAnalysisResult analyzeForThoughtType(ProofInput proof, ThoughtType thoughtType, String theorem) {
        ThoughtType type = thoughtType != null ? thoughtType : ThoughtType.FULL;
        log.debug("Running {} analysis", type.getValue());

        switch (type) {
            case PROOF_DECOMPOSITION:
                return ProofAnalysisResult.builder()
                        .decomposition(decomposer.decompose(proof, theorem))
                        .build();
            case DEPENDENCY_ANALYSIS: {
                ProofDecomposition decomposition = decomposer.decompose(proof, theorem);
                return ProofAnalysisResult.builder()
                        .decomposition(decomposition)
                        .recommendations(List.of(
                                "Proof depth: " + decomposition.getMaxDependencyDepth(),
                                "Atomic statements: " + decomposition.getAtomCount(),
                                "Has cycles: " + decomposition.getDependencies().isHasCycles()))
                        .build();
            }
            case CONSISTENCY_CHECK:
                return checkConsistency(proof, theorem);
            case GAP_IDENTIFICATION: {
                AnalysisBudget budget = AnalysisBudget.from(properties.getBudget());
                ProofDecomposition decomposition = decomposer.decompose(proof, theorem, budget);
                return ProofAnalysisResult.builder()
                        .gapAnalysis(gapAnalyzer.analyzeGaps(decomposition, budget.fork()))
                        .build();
            }
            case ASSUMPTION_TRACE:
                return ProofAnalysisResult.builder()
                        .assumptionAnalysis(assumptionTracker.analyzeAssumptions(decomposer.decompose(proof, theorem)))
                        .build();
            default:
                return analyzeProof(proof, theorem);
        }
    }

    @Override
    public ProofAnalysisResult checkConsistency(ProofInput proof, String theorem) {
        AnalysisBudget budget = AnalysisBudget.from(properties.getBudget());
        ProofDecomposition decomposition = decomposer.decompose(proof, theorem, budget);
        AnalysisBudget inconsistencyBudget = budget.fork();
        AnalysisBudget circularBudget = budget.fork();

        CompletableFuture<List<Inconsistency>> inconsistencyFuture =
                submit(() -> inconsistencyDetector.analyze(decomposition, inconsistencyBudget));
        CompletableFuture<CircularReasoningResult> circularFuture =
                submit(() -> circularDetector.detectCircularReasoning(decomposition, circularBudget));

        List<Inconsistency> inconsistencies = await(inconsistencyFuture);
        CircularReasoningResult circular = await(circularFuture);
        InconsistencySummary summary = inconsistencyDetector.getSummary(inconsistencies);

        double score = summary.isConsistent() ? 1 - summary.getWarningCount() * 0.05 : 0.3;
        ConsistencyReport report = buildReport(inconsistencies, summary, circular,
                inconsistencyDetector.detectFallacies(decomposition), Math.max(0, score));

        List<String> stoppedIn = exhaustedStages(budget, inconsistencyBudget, circularBudget);

        return ProofAnalysisResult.builder()
                .decomposition(decomposition)
                .consistencyReport(report)
                .overallScore(report.getOverallScore())
                .recommendations(stoppedIn.isEmpty() ? List.of() : List.of(stoppedEarly(stoppedIn)))
                .valid(stoppedIn.isEmpty() && report.isConsistent())
                .build();
    }

    /**
     * Stages where a budget ran out, in pipeline order. Forks of an exhausted
     * budget repeat its stage, so duplicates are dropped.
     */
    static List<String> exhaustedStages(AnalysisBudget... budgets) {
        return Arrays.stream(budgets)
                .filter(AnalysisBudget::isExhausted)
                .map(AnalysisBudget::getExhaustedIn)
                .distinct()
                .collect(Collectors.toList());
    }

    private static String stoppedEarly(List<String> stages) {
        return String.format("Analysis stopped early in %s after reaching its work limit; results may be partial",
                String.join(", ", stages));
    }

    private ConsistencyReport buildReport(List<Inconsistency> inconsistencies, InconsistencySummary summary,
                                          CircularReasoningResult circular, List<FallacyWarning> fallacies,
                                          double overallScore) {
        boolean circularReasoning = circular != null && circular.isHasCircularReasoning();

        List<String> parts = new ArrayList<>();
        if (!summary.isConsistent()) {
            parts.add(summary.getSummary());
        }
        if (circularReasoning) {
            parts.add(circular.getSummary());
        }

        return ConsistencyReport.builder()
                .consistent(summary.isConsistent() && !circularReasoning)
                .overallScore(overallScore)
                .inconsistencies(inconsistencies)
                .warnings(inconsistencies.stream()
                        .filter(i -> i.getSeverity() == InconsistencySeverity.WARNING)
                        .map(Inconsistency::getExplanation)
                        .collect(Collectors.toList()))
                .circularReasoning(circular != null ? circular.getCycles() : List.of())
                .fallacyWarnings(fallacies)
                .summary(parts.isEmpty()
                        ? "The proof is logically consistent with no circular reasoning detected."
                        : String.join(" ", parts))
                .build();
    }

    @Override
    public String generateReport(ProofAnalysisResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("# Proof Analysis Report");
        lines.add("");

        lines.add("## Overall Assessment");
        lines.add("- **Valid**: " + (Boolean.TRUE.equals(result.getValid()) ? "Yes" : "No"));
        lines.add("- **Score**: " + percent(result.getOverallScore() != null ? result.getOverallScore() : 0));
        lines.add("");

        ProofDecomposition decomposition = result.getDecomposition();
        if (decomposition != null) {
            lines.add("## Proof Structure");
            lines.add("- **Atomic Statements**: " + decomposition.getAtomCount());
            lines.add("- **Maximum Depth**: " + decomposition.getMaxDependencyDepth());
            lines.add("- **Rigor Level**: " + decomposition.getRigorLevel().getValue());
            lines.add("- **Completeness**: " + percent(decomposition.getCompleteness()));
            lines.add("");
        }

        ConsistencyReport consistency = result.getConsistencyReport();
        if (consistency != null) {
            lines.add("## Consistency Analysis");
            lines.add("- **Consistent**: " + (consistency.isConsistent() ? "Yes" : "No"));
            lines.add("- **Inconsistencies Found**: " + consistency.getInconsistencies().size());
            lines.add("- **Circular Reasoning**: " + (consistency.getCircularReasoning().isEmpty() ? "None" : "Detected"));
            if (!consistency.getInconsistencies().isEmpty()) {
                lines.add("");
                lines.add("### Inconsistencies");
                consistency.getInconsistencies().stream()
                        .limit(5)
                        .forEach(i -> lines.add(String.format("- [%s] %s",
                                i.getSeverity().getValue().toUpperCase(Locale.ROOT), i.getExplanation())));
            }
            lines.add("");
        }

        GapAnalysisResult gaps = result.getGapAnalysis();
        if (gaps != null) {
            lines.add("## Gap Analysis");
            lines.add("- **Gaps Found**: " + gaps.getGaps().size());
            lines.add("- **Implicit Assumptions**: " + gaps.getImplicitAssumptions().size());
            lines.add("- **Unjustified Steps**: " + gaps.getUnjustifiedSteps().size());
            lines.add("");
        }

        if (!result.getRecommendations().isEmpty()) {
            lines.add("## Recommendations");
            result.getRecommendations().stream().limit(10).forEach(r -> lines.add("- " + r));
            lines.add("");
        }

        return String.join("\n", lines);
    }

    @Override
    public EngineStats getStats() {
        ProofAnalysisProperties.Engine engine = properties.getEngine();
        Map<String, Boolean> features = new LinkedHashMap<>();
        features.put("decomposition", engine.isEnableDecomposition());
        features.put("gapAnalysis", engine.isEnableGapAnalysis());
        features.put("assumptionTracking", engine.isEnableAssumptionTracking());
        features.put("inconsistencyDetection", engine.isEnableInconsistencyDetection());
        features.put("circularDetection", engine.isEnableCircularDetection());

        return EngineStats.builder()
                .features(features)
                .version(VERSION)
                .build();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> pass) {
        if (!properties.getEngine().isParallelPasses()) {
            return CompletableFuture.completedFuture(pass.get());
        }
        try {
            return CompletableFuture.supplyAsync(pass, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Analysis executor saturated, running pass on caller thread: {}", e.getMessage());
            return CompletableFuture.completedFuture(pass.get());
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Keeps the first occurrence, comparing case- and whitespace-insensitively.
     */
    static List<String> deduplicate(List<String> recommendations) {
        Set<String> seen = new HashSet<>();
        List<String> unique = new ArrayList<>();
        for (String recommendation : recommendations) {
            String key = recommendation.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
            if (seen.add(key)) {
                unique.add(recommendation);
            }
        }
        return unique;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100);
    }
}
