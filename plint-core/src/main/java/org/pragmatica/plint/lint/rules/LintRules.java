package org.pragmatica.plint.lint.rules;

import java.util.List;
import java.util.Optional;

/// Registry of built-in rules.
public final class LintRules {
    private static final List<LintRule> RULES = List.of(new ProhibitForeachHandleRule());

    private LintRules() {}

    public static List<LintRule> all() {
        return RULES;
    }

    public static Optional<LintRule> byId(String ruleId) {
        return RULES.stream()
                    .filter(rule -> rule.ruleId()
                                        .equals(ruleId))
                    .findFirst();
    }
}
