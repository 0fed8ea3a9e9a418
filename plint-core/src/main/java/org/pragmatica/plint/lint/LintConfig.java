package org.pragmatica.plint.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/// Configuration for the linter.
///
/// @param ruleSeverities  per-rule severity overrides; rules not listed keep their default
/// @param disabledRules   rules that never run
/// @param minimumSeverity diagnostics below this severity are dropped
/// @param themes          when non-empty, only rules carrying one of these themes run
/// @param failOnWarning   treat warnings as failures when deciding the exit status
/// @param parallel        lint files concurrently
public record LintConfig(Map<String, DiagnosticSeverity> ruleSeverities,
                         Set<String> disabledRules,
                         DiagnosticSeverity minimumSeverity,
                         Set<String> themes,
                         boolean failOnWarning,
                         boolean parallel) {
    public LintConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        disabledRules = Set.copyOf(disabledRules);
        themes = Set.copyOf(themes);
    }

    public static final LintConfig DEFAULT = new LintConfig(Map.of(),
                                                            Set.of(),
                                                            DiagnosticSeverity.INFO,
                                                            Set.of(),
                                                            false,
                                                            false);

    public static LintConfig defaultConfig() {
        return DEFAULT;
    }

    public LintConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new LintConfig(newSeverities, disabledRules, minimumSeverity, themes, failOnWarning, parallel);
    }

    public LintConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new LintConfig(ruleSeverities, newDisabled, minimumSeverity, themes, failOnWarning, parallel);
    }

    public LintConfig withMinimumSeverity(DiagnosticSeverity minimumSeverity) {
        return new LintConfig(ruleSeverities, disabledRules, minimumSeverity, themes, failOnWarning, parallel);
    }

    public LintConfig withThemes(Set<String> themes) {
        return new LintConfig(ruleSeverities, disabledRules, minimumSeverity, themes, failOnWarning, parallel);
    }

    public LintConfig withFailOnWarning(boolean failOnWarning) {
        return new LintConfig(ruleSeverities, disabledRules, minimumSeverity, themes, failOnWarning, parallel);
    }

    public LintConfig withParallel(boolean parallel) {
        return new LintConfig(ruleSeverities, disabledRules, minimumSeverity, themes, failOnWarning, parallel);
    }
}
