package io.github.cyfko.surveylogic.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable result of one survey analysis.
 * <p>
 * Instances are assembled through {@link Builder} by the analyzer and never change
 * afterwards. Name sets are sorted; entry and exit points keep graph and declaration order;
 * warnings keep the order of {@link WarningKind} and hold no duplicates.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class SurveyReport {

    private final String surveyName;
    private final int totalStates;
    private final int totalTransitions;
    private final int totalVariables;
    private final int totalBlocks;

    private final Map<String, Integer> variableUsage;
    private final Set<String> undefinedVariables;
    private final Set<String> unusedVariables;

    private final List<String> entryPoints;
    private final List<String> exitPoints;
    private final Set<String> unreachableStates;
    private final boolean hasCycles;
    private final List<String> exampleCycle;

    private final int maxExpressionDepth;
    private final double avgExpressionDepth;
    private final int totalExpressionNodes;

    private final int statesWithValidation;
    private final int statesWithEntryGuard;
    private final int statesWithVersion;
    private final double validationCoveragePercent;

    private final int maxTransitionsPerState;
    private final double avgTransitionsPerState;

    private final List<Warning> warnings;

    private SurveyReport(Builder b) {
        this.surveyName = Objects.requireNonNull(b._surveyName, "Survey name cannot be null");
        this.totalStates = b._totalStates;
        this.totalTransitions = b._totalTransitions;
        this.totalVariables = b._totalVariables;
        this.totalBlocks = b._totalBlocks;
        this.variableUsage = Collections.unmodifiableMap(new LinkedHashMap<>(b._variableUsage));
        this.undefinedVariables = Collections.unmodifiableSet(new TreeSet<>(b._undefinedVariables));
        this.unusedVariables = Collections.unmodifiableSet(new TreeSet<>(b._unusedVariables));
        this.entryPoints = List.copyOf(b._entryPoints);
        this.exitPoints = List.copyOf(b._exitPoints);
        this.unreachableStates = Collections.unmodifiableSet(new TreeSet<>(b._unreachableStates));
        this.hasCycles = b._hasCycles;
        this.exampleCycle = List.copyOf(b._exampleCycle);
        this.maxExpressionDepth = b._maxExpressionDepth;
        this.avgExpressionDepth = b._avgExpressionDepth;
        this.totalExpressionNodes = b._totalExpressionNodes;
        this.statesWithValidation = b._statesWithValidation;
        this.statesWithEntryGuard = b._statesWithEntryGuard;
        this.statesWithVersion = b._statesWithVersion;
        this.validationCoveragePercent = b._validationCoveragePercent;
        this.maxTransitionsPerState = b._maxTransitionsPerState;
        this.avgTransitionsPerState = b._avgTransitionsPerState;
        this.warnings = List.copyOf(b._warnings);
    }

    public static Builder builder(String surveyName) {
        return new Builder(surveyName);
    }

    public String surveyName() { return surveyName; }
    public int totalStates() { return totalStates; }
    public int totalTransitions() { return totalTransitions; }
    public int totalVariables() { return totalVariables; }
    public int totalBlocks() { return totalBlocks; }

    /** Reference count per variable name, ordered by name. */
    public Map<String, Integer> variableUsage() { return variableUsage; }
    public Set<String> undefinedVariables() { return undefinedVariables; }
    public Set<String> unusedVariables() { return unusedVariables; }

    public List<String> entryPoints() { return entryPoints; }
    public List<String> exitPoints() { return exitPoints; }
    public Set<String> unreachableStates() { return unreachableStates; }
    public boolean hasCycles() { return hasCycles; }

    /** One cycle, first node repeated at the end; empty when {@link #hasCycles()} is false. */
    public List<String> exampleCycle() { return exampleCycle; }

    public int maxExpressionDepth() { return maxExpressionDepth; }
    public double avgExpressionDepth() { return avgExpressionDepth; }
    public int totalExpressionNodes() { return totalExpressionNodes; }

    public int statesWithValidation() { return statesWithValidation; }
    public int statesWithEntryGuard() { return statesWithEntryGuard; }
    public int statesWithVersion() { return statesWithVersion; }
    public double validationCoveragePercent() { return validationCoveragePercent; }

    public int maxTransitionsPerState() { return maxTransitionsPerState; }
    public double avgTransitionsPerState() { return avgTransitionsPerState; }

    public List<Warning> warnings() { return warnings; }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> warningMessages() {
        return warnings.stream().map(Warning::message).toList();
    }

    public int usageOf(String variableName) {
        return variableUsage.getOrDefault(variableName, 0);
    }

    @Override
    public String toString() {
        return String.format("SurveyReport{survey='%s', states=%d, transitions=%d, variables=%d, warnings=%d}",
                surveyName, totalStates, totalTransitions, totalVariables, warnings.size());
    }

    public static class Builder {
        private final String _surveyName;
        private int _totalStates;
        private int _totalTransitions;
        private int _totalVariables;
        private int _totalBlocks;
        private Map<String, Integer> _variableUsage = Map.of();
        private Set<String> _undefinedVariables = Set.of();
        private Set<String> _unusedVariables = Set.of();
        private List<String> _entryPoints = List.of();
        private List<String> _exitPoints = List.of();
        private Set<String> _unreachableStates = Set.of();
        private boolean _hasCycles;
        private List<String> _exampleCycle = List.of();
        private int _maxExpressionDepth;
        private double _avgExpressionDepth;
        private int _totalExpressionNodes;
        private int _statesWithValidation;
        private int _statesWithEntryGuard;
        private int _statesWithVersion;
        private double _validationCoveragePercent;
        private int _maxTransitionsPerState;
        private double _avgTransitionsPerState;
        private final Set<Warning> _warnings = new LinkedHashSet<>();

        private Builder(String surveyName) {
            this._surveyName = surveyName;
        }

        public Builder totals(int states, int transitions, int variables, int blocks) {
            this._totalStates = states;
            this._totalTransitions = transitions;
            this._totalVariables = variables;
            this._totalBlocks = blocks;
            return this;
        }

        public Builder variableUsage(Map<String, Integer> usage) { this._variableUsage = usage; return this; }
        public Builder undefinedVariables(Set<String> names) { this._undefinedVariables = names; return this; }
        public Builder unusedVariables(Set<String> names) { this._unusedVariables = names; return this; }
        public Builder entryPoints(List<String> ids) { this._entryPoints = ids; return this; }
        public Builder exitPoints(List<String> ids) { this._exitPoints = ids; return this; }
        public Builder unreachableStates(Set<String> ids) { this._unreachableStates = ids; return this; }

        public Builder cycle(List<String> path) {
            this._exampleCycle = path;
            this._hasCycles = !path.isEmpty();
            return this;
        }

        public Builder expressionComplexity(int maxDepth, double avgDepth, int totalNodes) {
            this._maxExpressionDepth = maxDepth;
            this._avgExpressionDepth = avgDepth;
            this._totalExpressionNodes = totalNodes;
            return this;
        }

        public Builder coverage(int withValidation, int withEntryGuard, int withVersion, double validationPercent) {
            this._statesWithValidation = withValidation;
            this._statesWithEntryGuard = withEntryGuard;
            this._statesWithVersion = withVersion;
            this._validationCoveragePercent = validationPercent;
            return this;
        }

        public Builder transitionMetrics(int max, double avg) {
            this._maxTransitionsPerState = max;
            this._avgTransitionsPerState = avg;
            return this;
        }

        /**
         * Appends a warning unless an equal one was already added.
         *
         * @param warning the finding
         * @return this builder
         */
        public Builder warning(Warning warning) {
            this._warnings.add(Objects.requireNonNull(warning, "Warning cannot be null"));
            return this;
        }

        public SurveyReport build() {
            return new SurveyReport(this);
        }
    }
}
