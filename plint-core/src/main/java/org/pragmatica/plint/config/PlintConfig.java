package org.pragmatica.plint.config;

import org.pragmatica.plint.lint.LintConfig;
import org.pragmatica.plint.lint.LintContext;

import java.util.List;

/// Top-level configuration read from `plint.toml`.
///
/// @param lint    rule selection and severities
/// @param exclude path globs that are never linted
public record PlintConfig(LintConfig lint, List<String> exclude) {
    public static final String DEFAULT_FILE_NAME = "plint.toml";

    public PlintConfig {
        exclude = List.copyOf(exclude);
    }

    public static PlintConfig defaultConfig() {
        return new PlintConfig(LintConfig.defaultConfig(), List.of());
    }

    public PlintConfig withLint(LintConfig lint) {
        return new PlintConfig(lint, exclude);
    }

    public LintContext toContext() {
        return LintContext.lintContext(exclude, lint);
    }
}
