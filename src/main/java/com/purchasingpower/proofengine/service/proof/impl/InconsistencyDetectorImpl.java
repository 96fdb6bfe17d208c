package com.purchasingpower.proofengine.service.proof.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.FallacyWarning;
import com.purchasingpower.proofengine.model.analysis.InconsistencySummary;
import com.purchasingpower.proofengine.model.proof.DependencyEdge;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.Inconsistency;
import com.purchasingpower.proofengine.model.proof.InconsistencySeverity;
import com.purchasingpower.proofengine.model.proof.InconsistencyType;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.proof.AnalysisBudget;
import com.purchasingpower.proofengine.service.proof.InconsistencyDetector;
import com.purchasingpower.proofengine.service.proof.pattern.FallacyPatternCatalog;
import com.purchasingpower.proofengine.service.proof.pattern.FallacyPatternCatalog.FallacyPattern;
import com.purchasingpower.proofengine.util.TextHeuristics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class InconsistencyDetectorImpl implements InconsistencyDetector {

    private static final String STAGE = "inconsistency detection";
    private static final int CI = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /**
     * Cross-sentence fallacy patterns backtrack heavily; longer proofs skip them.
     */
    private static final int MAX_CROSS_SENTENCE_LENGTH = 4000;

    private record PolarityPattern(Pattern positive, Pattern negative, String description) {
    }

    private record DomainRule(Pattern pattern, String violation, String domain, Predicate<Matcher> validator) {
    }

    private record UndefinedOperation(Pattern pattern, String operation) {
    }

    private static final List<PolarityPattern> POLARITY_PATTERNS = List.of(
            new PolarityPattern(Pattern.compile("(\\w+)\\s*>\\s*0"), Pattern.compile("(\\w+)\\s*(?:<=|≤)\\s*0"),
                    "Positive and non-positive contradiction"),
            new PolarityPattern(Pattern.compile("(\\w+)\\s*<\\s*0"), Pattern.compile("(\\w+)\\s*(?:>=|≥)\\s*0"),
                    "Negative and non-negative contradiction"),
            new PolarityPattern(Pattern.compile("(\\w+)\\s*=\\s*0"), Pattern.compile("(\\w+)\\s*(?:!=|≠|<>)\\s*0"),
                    "Zero and non-zero contradiction"),
            new PolarityPattern(Pattern.compile("(\\w+)\\s+is\\s+true", CI), Pattern.compile("(\\w+)\\s+is\\s+false", CI),
                    "True and false contradiction"),
            new PolarityPattern(Pattern.compile("(\\w+)\\s+is\\s+even", CI), Pattern.compile("(\\w+)\\s+is\\s+odd", CI),
                    "Even and odd contradiction"),
            new PolarityPattern(Pattern.compile("(\\w+)\\s+is\\s+positive", CI),
                    Pattern.compile("(\\w+)\\s+is\\s+(?:negative|non-positive)", CI),
                    "Positive property contradiction"),
            new PolarityPattern(Pattern.compile("(\\w+)\\s+is\\s+rational", CI),
                    Pattern.compile("(\\w+)\\s+is\\s+irrational", CI),
                    "Rational and irrational contradiction"),
            new PolarityPattern(Pattern.compile("(\\w+)\\s+is\\s+finite", CI),
                    Pattern.compile("(\\w+)\\s+is\\s+infinite", CI),
                    "Finite and infinite contradiction"),
            new PolarityPattern(Pattern.compile("(?:there\\s+)?exists?\\s+(\\w+)", CI),
                    Pattern.compile("(?:\\bno|does\\s+not\\s+exist|cannot\\s+exist)\\s+(\\w+)", CI),
                    "Existence contradiction")
    );

    private static final List<Pattern> TYPE_DECLARATIONS = List.of(
            Pattern.compile("(?:let\\s+)?(\\w+)\\s+be\\s+an?\\s+(\\w+)", CI),
            Pattern.compile("(\\w+)\\s+is\\s+an?\\s+(\\w+)", CI),
            Pattern.compile("for\\s+(?:all|any|every)\\s+(\\w+)\\s+in\\s+(\\w+)", CI),
            Pattern.compile("(\\w+)\\s*∈\\s*(\\w+)", CI));

    private static final Map<String, Set<String>> SUPERTYPES = ImmutableMap.<String, Set<String>>builder()
            .put("natural", ImmutableSet.of("integer", "real", "complex"))
            .put("integer", ImmutableSet.of("real", "complex"))
            .put("rational", ImmutableSet.of("real", "complex"))
            .put("real", ImmutableSet.of("complex"))
            .put("positive", ImmutableSet.of("real", "integer"))
            .put("negative", ImmutableSet.of("real", "integer"))
            .build();

    private static final List<DomainRule> DOMAIN_RULES = List.of(
            new DomainRule(Pattern.compile("sqrt\\s*\\(\\s*(-[\\d.]+|negative)", CI),
                    "Square root of negative number", "real numbers", m -> true),
            new DomainRule(Pattern.compile("log\\s*\\(\\s*(-[\\d.]+|0|zero|non-?positive)", CI),
                    "Logarithm of non-positive number", "positive real numbers", m -> true),
            new DomainRule(Pattern.compile("arcsin\\s*\\(\\s*([\\d.]+)"),
                    "Arcsin of value outside [-1, 1]", "[-1, 1]", InconsistencyDetectorImpl::outsideUnitInterval),
            new DomainRule(Pattern.compile("(\\w+)\\s*/\\s*0(?!\\d)(?!\\.\\d)"),
                    "Division by zero", "non-zero divisor", m -> true));

    private static final List<UndefinedOperation> UNDEFINED_OPERATIONS = List.of(
            new UndefinedOperation(Pattern.compile("0\\s*/\\s*0"), "0/0 - indeterminate form"),
            new UndefinedOperation(Pattern.compile("∞\\s*[-/]\\s*∞"), "∞ - ∞ or ∞/∞ - indeterminate form"),
            new UndefinedOperation(Pattern.compile("0\\s*\\*\\s*∞|∞\\s*\\*\\s*0"), "0 × ∞ - indeterminate form"),
            new UndefinedOperation(Pattern.compile("0\\s*\\^\\s*0"), "0^0 - undefined/context-dependent"),
            new UndefinedOperation(Pattern.compile("(\\w+)\\s*\\^\\s*\\(?\\s*-\\d+\\s*\\)?.*\\1\\s*=\\s*0", CI),
                    "Negative power of zero"));

    private static final Pattern UNIVERSAL_PREDICATE = Pattern.compile(
            "(?:for\\s+all|∀)\\s+(\\w+).*?(\\w+)\\s+is\\s+(\\w+)", CI);
    private static final Pattern NEGATED_UNIVERSAL_PREDICATE = Pattern.compile(
            "(?:for\\s+all|∀)\\s+(\\w+).*?(\\w+)\\s+is\\s+not\\s+(\\w+)", CI);
    private static final Pattern UNIVERSAL_BINDER = Pattern.compile("(?:for\\s+all|∀)\\s+(\\w+)", CI);
    private static final Pattern EXISTENTIAL_BINDER = Pattern.compile("(?:there\\s+exists?|∃)\\s+(\\w+)", CI);
    private static final Pattern SINGLE_LETTER = Pattern.compile("\\b([a-zA-Z])\\b");
    private static final Pattern FORALL_EXISTS = Pattern.compile("∀\\s*(\\w+).*∃\\s*(\\w+).*\\1.*\\2");
    private static final Pattern EXISTS_FORALL = Pattern.compile("∃\\s*(\\w+).*∀\\s*(\\w+).*\\1.*\\2");

    private static final Pattern IS_TRUE = Pattern.compile("^(.+) is true$");
    private static final Pattern IS_FALSE = Pattern.compile("^(.+) is false$");
    private static final Pattern HOLDS = Pattern.compile("^(.+) holds$");
    private static final Pattern DOES_NOT_HOLD = Pattern.compile("^(.+) does not hold$");
    private static final Pattern IT_IS_TRUE = Pattern.compile("^it is true that (.+)$");
    private static final Pattern IT_IS_FALSE = Pattern.compile("^it is false that (.+)$");

    private final ProofAnalysisProperties properties;

    @Override
    public List<Inconsistency> analyze(ProofDecomposition decomposition) {
        return analyze(decomposition, AnalysisBudget.from(properties.getBudget()));
    }

    @Override
    public List<Inconsistency> analyze(ProofDecomposition decomposition, AnalysisBudget budget) {
        Preconditions.checkNotNull(decomposition, "decomposition must not be null");
        ProofAnalysisProperties.Inconsistency settings = properties.getInconsistency();
        List<Statement> atoms = decomposition.getAtoms();

        List<Inconsistency.InconsistencyBuilder> found = new ArrayList<>(detectContradictions(atoms, budget));
        if (settings.isStrictTyping()) {
            found.addAll(detectTypeMismatches(atoms));
        }
        if (settings.isCheckDomains()) {
            found.addAll(detectDomainViolations(atoms));
        }
        found.addAll(detectUndefinedOperations(atoms));
        found.addAll(detectAxiomConflicts(atoms, budget));
        if (settings.isCheckQuantifiers()) {
            found.addAll(detectQuantifierErrors(atoms, decomposition.getDependencies()));
        }

        List<Inconsistency> inconsistencies = new ArrayList<>(found.size());
        for (int i = 0; i < found.size(); i++) {
            inconsistencies.add(found.get(i).id("inc-" + (i + 1)).build());
        }

        log.debug("Inconsistency detection for {}: {} findings", decomposition.getId(), inconsistencies.size());
        return List.copyOf(inconsistencies);
    }

    /**
     * Pairwise search over the first sqrt(maxPairwiseComparisons) statements only.
     */
    private List<Inconsistency.InconsistencyBuilder> detectContradictions(List<Statement> atoms, AnalysisBudget budget) {
        List<Inconsistency.InconsistencyBuilder> contradictions = new ArrayList<>();
        int limit = (int) Math.min(atoms.size(),
                Math.sqrt(properties.getInconsistency().getMaxPairwiseComparisons()));

        for (int i = 0; i < limit; i++) {
            for (int j = i + 1; j < limit; j++) {
                if (!budget.tryConsume(STAGE)) {
                    return contradictions;
                }
                Statement a = atoms.get(i);
                Statement b = atoms.get(j);

                if (isSyntacticNegation(a.getText(), b.getText())) {
                    contradictions.add(Inconsistency.builder()
                            .type(InconsistencyType.DIRECT_CONTRADICTION)
                            .involvedStatements(List.of(a.getId(), b.getId()))
                            .explanation(String.format("Statement \"%s\" directly contradicts \"%s\"",
                                    TextHeuristics.truncate(a.getText(), 40), TextHeuristics.truncate(b.getText(), 40)))
                            .severity(InconsistencySeverity.CRITICAL)
                            .suggestedResolution("Review the derivation of both statements to find the error"));
                }

                for (PolarityPattern pattern : POLARITY_PATTERNS) {
                    polarityConflict(pattern.positive(), a, pattern.negative(), b)
                            .ifPresentOrElse(subject -> contradictions.add(polarityInconsistency(pattern, subject, a, b)),
                                    () -> polarityConflict(pattern.negative(), a, pattern.positive(), b)
                                            .ifPresent(subject -> contradictions.add(
                                                    polarityInconsistency(pattern, subject, a, b))));
                }
            }
        }
        return contradictions;
    }

    private Optional<String> polarityConflict(Pattern first, Statement a, Pattern second, Statement b) {
        Matcher ma = first.matcher(a.getText());
        Matcher mb = second.matcher(b.getText());
        if (ma.find() && mb.find() && ma.group(1).equals(mb.group(1))) {
            return Optional.of(ma.group(1));
        }
        return Optional.empty();
    }

    private Inconsistency.InconsistencyBuilder polarityInconsistency(PolarityPattern pattern, String subject,
                                                                     Statement a, Statement b) {
        return Inconsistency.builder()
                .type(InconsistencyType.DIRECT_CONTRADICTION)
                .involvedStatements(List.of(a.getId(), b.getId()))
                .explanation(String.format("%s: \"%s\" has conflicting properties", pattern.description(), subject))
                .severity(InconsistencySeverity.CRITICAL)
                .suggestedResolution("Check the assumptions about the variable");
    }

    /**
     * True for "P" / "not P", "P" / "¬P", "P is true" / "P is false",
     * "P holds" / "P does not hold" and "it is true that P" / "it is false that P".
     */
    static boolean isSyntacticNegation(String first, String second) {
        String a = first.toLowerCase(Locale.ROOT).trim();
        String b = second.toLowerCase(Locale.ROOT).trim();

        if (b.equals("not " + a) || a.equals("not " + b)) {
            return true;
        }
        if (b.equals("¬ " + a) || b.equals("¬" + a) || a.equals("¬ " + b) || a.equals("¬" + b)) {
            return true;
        }
        return samePredicate(IS_TRUE, a, IS_FALSE, b)
                || samePredicate(IS_TRUE, b, IS_FALSE, a)
                || samePredicate(HOLDS, a, DOES_NOT_HOLD, b)
                || samePredicate(HOLDS, b, DOES_NOT_HOLD, a)
                || samePredicate(IT_IS_TRUE, a, IT_IS_FALSE, b)
                || samePredicate(IT_IS_TRUE, b, IT_IS_FALSE, a);
    }

    private static boolean samePredicate(Pattern affirmed, String a, Pattern denied, String b) {
        Matcher ma = affirmed.matcher(stripPeriod(a));
        Matcher mb = denied.matcher(stripPeriod(b));
        return ma.matches() && mb.matches() && ma.group(1).equals(mb.group(1));
    }

    private static String stripPeriod(String text) {
        return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
    }

    private List<Inconsistency.InconsistencyBuilder> detectTypeMismatches(List<Statement> atoms) {
        List<Inconsistency.InconsistencyBuilder> mismatches = new ArrayList<>();
        Map<String, String[]> declaredTypes = new HashMap<>();

        for (Statement atom : atoms) {
            for (Pattern declaration : TYPE_DECLARATIONS) {
                Matcher matcher = declaration.matcher(atom.getText());
                if (!matcher.find()) {
                    continue;
                }
                String variable = matcher.group(1);
                String type = matcher.group(2);
                String[] existing = declaredTypes.get(variable);

                if (existing != null && !areTypesCompatible(existing[0], type)) {
                    mismatches.add(Inconsistency.builder()
                            .type(InconsistencyType.TYPE_MISMATCH)
                            .involvedStatements(List.of(existing[1], atom.getId()))
                            .explanation(String.format("Variable \"%s\" is declared as both \"%s\" and \"%s\"",
                                    variable, existing[0], type))
                            .severity(InconsistencySeverity.ERROR)
                            .suggestedResolution(String.format("Clarify the type of \"%s\"", variable)));
                } else {
                    declaredTypes.put(variable, new String[]{type, atom.getId()});
                }
            }
        }
        return mismatches;
    }

    static boolean areTypesCompatible(String first, String second) {
        String a = first.toLowerCase(Locale.ROOT);
        String b = second.toLowerCase(Locale.ROOT);
        return a.equals(b)
                || SUPERTYPES.getOrDefault(a, Set.of()).contains(b)
                || SUPERTYPES.getOrDefault(b, Set.of()).contains(a);
    }

    private List<Inconsistency.InconsistencyBuilder> detectDomainViolations(List<Statement> atoms) {
        List<Inconsistency.InconsistencyBuilder> violations = new ArrayList<>();
        for (Statement atom : atoms) {
            for (DomainRule rule : DOMAIN_RULES) {
                Matcher matcher = rule.pattern().matcher(atom.getText());
                if (matcher.find() && rule.validator().test(matcher)) {
                    violations.add(Inconsistency.builder()
                            .type(InconsistencyType.DOMAIN_VIOLATION)
                            .involvedStatements(List.of(atom.getId()))
                            .explanation(String.format("%s in \"%s\"", rule.violation(),
                                    TextHeuristics.truncate(atom.getText(), 50)))
                            .severity(InconsistencySeverity.ERROR)
                            .suggestedResolution("Ensure the argument is in the valid domain: " + rule.domain()));
                }
            }
        }
        return violations;
    }

    private static boolean outsideUnitInterval(Matcher matcher) {
        try {
            return Math.abs(Double.parseDouble(matcher.group(1))) > 1;
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable arcsin argument '{}'", matcher.group(1));
            return false;
        }
    }

    private List<Inconsistency.InconsistencyBuilder> detectUndefinedOperations(List<Statement> atoms) {
        List<Inconsistency.InconsistencyBuilder> undefined = new ArrayList<>();
        for (Statement atom : atoms) {
            for (UndefinedOperation operation : UNDEFINED_OPERATIONS) {
                if (operation.pattern().matcher(atom.getText()).find()) {
                    undefined.add(Inconsistency.builder()
                            .type(InconsistencyType.UNDEFINED_OPERATION)
                            .involvedStatements(List.of(atom.getId()))
                            .explanation("Undefined operation: " + operation.operation())
                            .severity(InconsistencySeverity.CRITICAL)
                            .suggestedResolution("This operation is mathematically undefined or indeterminate"));
                }
            }
        }
        return undefined;
    }

    private List<Inconsistency.InconsistencyBuilder> detectAxiomConflicts(List<Statement> atoms, AnalysisBudget budget) {
        List<Statement> axioms = atoms.stream()
                .filter(a -> a.getType() == StatementType.AXIOM)
                .collect(Collectors.toList());

        List<Inconsistency.InconsistencyBuilder> conflicts = new ArrayList<>();
        for (int i = 0; i < axioms.size(); i++) {
            for (int j = i + 1; j < axioms.size(); j++) {
                if (!budget.tryConsume(STAGE)) {
                    return conflicts;
                }
                Statement a = axioms.get(i);
                Statement b = axioms.get(j);
                if (axiomsMayConflict(a, b)) {
                    conflicts.add(Inconsistency.builder()
                            .type(InconsistencyType.AXIOM_CONFLICT)
                            .involvedStatements(List.of(a.getId(), b.getId()))
                            .explanation(String.format("Axioms may be in conflict: \"%s\" and \"%s\"",
                                    TextHeuristics.truncate(a.getText(), 30), TextHeuristics.truncate(b.getText(), 30)))
                            .severity(InconsistencySeverity.WARNING)
                            .suggestedResolution("Verify that these axioms are consistent in the intended model"));
                }
            }
        }
        return conflicts;
    }

    private boolean axiomsMayConflict(Statement a, Statement b) {
        if (isSyntacticNegation(a.getText(), b.getText())) {
            return true;
        }
        return universalPredicateConflict(a.getText(), b.getText())
                || universalPredicateConflict(b.getText(), a.getText());
    }

    private boolean universalPredicateConflict(String affirmed, String denied) {
        Matcher positive = UNIVERSAL_PREDICATE.matcher(affirmed);
        Matcher negative = NEGATED_UNIVERSAL_PREDICATE.matcher(denied);
        return positive.find() && negative.find()
                && !"not".equalsIgnoreCase(positive.group(3))
                && positive.group(2).equals(negative.group(2))
                && positive.group(3).equals(negative.group(3));
    }

    private List<Inconsistency.InconsistencyBuilder> detectQuantifierErrors(List<Statement> atoms, DependencyGraph graph) {
        List<Inconsistency.InconsistencyBuilder> errors = new ArrayList<>();
        Map<String, String> bindingStatement = new HashMap<>();

        for (Statement atom : atoms) {
            String text = atom.getText();
            Matcher universal = UNIVERSAL_BINDER.matcher(text);
            if (universal.find()) {
                bindingStatement.put(universal.group(1), atom.getId());
            }
            Matcher existential = EXISTENTIAL_BINDER.matcher(text);
            if (existential.find()) {
                bindingStatement.put(existential.group(1), atom.getId());
            }

            Set<String> uses = new LinkedHashSet<>();
            Matcher letters = SINGLE_LETTER.matcher(text);
            while (letters.find()) {
                uses.add(letters.group(1));
            }
            for (String variable : uses) {
                String scope = bindingStatement.get(variable);
                if (scope != null && !isInScope(atom.getId(), scope, graph)) {
                    errors.add(Inconsistency.builder()
                            .type(InconsistencyType.QUANTIFIER_ERROR)
                            .involvedStatements(List.of(scope, atom.getId()))
                            .explanation(String.format("Variable \"%s\" used outside its quantifier scope", variable))
                            .severity(InconsistencySeverity.ERROR)
                            .suggestedResolution(String.format("Ensure \"%s\" is properly bound in the current context",
                                    variable)));
                }
            }

            if (FORALL_EXISTS.matcher(text).find() && EXISTS_FORALL.matcher(text).find()) {
                errors.add(Inconsistency.builder()
                        .type(InconsistencyType.QUANTIFIER_ERROR)
                        .involvedStatements(List.of(atom.getId()))
                        .explanation("Ambiguous quantifier order may lead to different meanings")
                        .severity(InconsistencySeverity.WARNING)
                        .suggestedResolution("Clarify the intended quantifier order (∀∃ vs ∃∀ has different meaning)"));
            }
        }
        return errors;
    }

    /**
     * A statement is in scope when it is reachable from the binding statement along dependency edges.
     */
    private boolean isInScope(String statementId, String scopeId, DependencyGraph graph) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(scopeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(statementId)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (DependencyEdge edge : graph.getEdges()) {
                if (edge.getFrom().equals(current) && !visited.contains(edge.getTo())) {
                    queue.add(edge.getTo());
                }
            }
        }
        return false;
    }

    @Override
    public InconsistencySummary getSummary(List<Inconsistency> inconsistencies) {
        int critical = countBySeverity(inconsistencies, InconsistencySeverity.CRITICAL);
        int errors = countBySeverity(inconsistencies, InconsistencySeverity.ERROR);
        int warnings = countBySeverity(inconsistencies, InconsistencySeverity.WARNING);

        String summary;
        if (critical > 0) {
            summary = String.format("CRITICAL: %d critical inconsistencies found. The proof is invalid.", critical);
        } else if (errors > 0) {
            summary = String.format("ERROR: %d errors found that need to be addressed.", errors);
        } else if (warnings > 0) {
            summary = String.format("WARNING: %d potential issues found. Review recommended.", warnings);
        } else {
            summary = "No inconsistencies detected. The proof appears to be consistent.";
        }

        return InconsistencySummary.builder()
                .consistent(critical == 0 && errors == 0)
                .criticalCount(critical)
                .errorCount(errors)
                .warningCount(warnings)
                .summary(summary)
                .build();
    }

    private static int countBySeverity(List<Inconsistency> inconsistencies, InconsistencySeverity severity) {
        return (int) inconsistencies.stream().filter(i -> i.getSeverity() == severity).count();
    }

    @Override
    public List<FallacyWarning> detectFallacies(ProofDecomposition decomposition) {
        List<FallacyWarning> warnings = new ArrayList<>();
        String proofText = decomposition.getAtoms().stream()
                .map(Statement::getText)
                .collect(Collectors.joining(" "));
        String original = decomposition.getOriginalProof() != null && !decomposition.getOriginalProof().isBlank()
                ? decomposition.getOriginalProof() : proofText;

        for (FallacyPattern pattern : FallacyPatternCatalog.PATTERNS) {
            if (pattern.crossSentence()) {
                if (original.length() > MAX_CROSS_SENTENCE_LENGTH) {
                    log.debug("Skipping {} on a proof of {} characters", pattern.id(), original.length());
                    continue;
                }
                Matcher matcher = pattern.pattern().matcher(original);
                if (matcher.find()) {
                    warnings.add(toWarning(pattern, null, matcher.group()));
                }
                continue;
            }
            for (Statement atom : decomposition.getAtoms()) {
                Matcher matcher = pattern.pattern().matcher(atom.getText());
                if (matcher.find()) {
                    warnings.add(toWarning(pattern, atom.getId(), matcher.group()));
                }
            }
        }
        return warnings;
    }

    private FallacyWarning toWarning(FallacyPattern pattern, String statementId, String matched) {
        return FallacyWarning.builder()
                .patternId(pattern.id())
                .name(pattern.name())
                .category(pattern.category())
                .severity(pattern.severity())
                .statementId(statementId)
                .matchedText(TextHeuristics.truncate(matched, 80))
                .suggestion(pattern.suggestion())
                .build();
    }
}
