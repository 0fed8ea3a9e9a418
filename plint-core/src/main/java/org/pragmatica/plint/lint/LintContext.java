package org.pragmatica.plint.lint;

import org.pragmatica.plint.lint.rules.LintRule;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/// Context for lint analysis providing configuration and the file being checked.
public record LintContext(List<Pattern> excludedPathPatterns,
                          LintConfig config,
                          String fileName) {
    public LintContext {
        excludedPathPatterns = List.copyOf(excludedPathPatterns);
    }

    /// Check if a file should be linted (not matched by any exclude glob).
    ///
    /// Globs are relative to the working directory; absolute paths below it are
    /// matched by their relative form as well.
    public boolean shouldLint(Path path) {
        return shouldLint(path, Path.of("")
                                    .toAbsolutePath());
    }

    boolean shouldLint(Path path, Path baseDirectory) {
        if (excludedPathPatterns.isEmpty()) {
            return true;
        }
        var normalized = path.normalize();
        var base = baseDirectory.normalize();
        var candidates = normalized.isAbsolute() && normalized.startsWith(base)
                         ? List.of(slashed(normalized), slashed(base.relativize(normalized)))
                         : List.of(slashed(normalized));
        return excludedPathPatterns.stream()
                                   .noneMatch(pattern -> candidates.stream()
                                                                   .anyMatch(candidate -> pattern.matcher(candidate)
                                                                                                 .matches()));
    }

    private static String slashed(Path path) {
        return path.toString()
                   .replace('\\', '/');
    }

    /// Configured severity for a rule, falling back to the rule's own default.
    public DiagnosticSeverity severityFor(LintRule rule) {
        return config.ruleSeverities()
                     .getOrDefault(rule.ruleId(), rule.defaultSeverity());
    }

    /// Check if a rule is enabled and selected by the theme filter.
    public boolean isRuleEnabled(LintRule rule) {
        if (config.disabledRules()
                  .contains(rule.ruleId())) {
            return false;
        }
        return config.themes()
                     .isEmpty() || !Collections.disjoint(config.themes(), rule.themes());
    }

    public boolean isReported(DiagnosticSeverity severity) {
        return severity.isAtLeast(config.minimumSeverity());
    }

    public static LintContext defaultContext() {
        return new LintContext(List.of(), LintConfig.defaultConfig(), "-");
    }

    public static LintContext lintContext(List<String> excludePaths, LintConfig config) {
        return new LintContext(compile(excludePaths), config, "-");
    }

    public LintContext withConfig(LintConfig config) {
        return new LintContext(excludedPathPatterns, config, fileName);
    }

    public LintContext withFileName(String fileName) {
        return new LintContext(excludedPathPatterns, config, fileName);
    }

    public LintContext withExcludePaths(List<String> globs) {
        return new LintContext(compile(globs), config, fileName);
    }

    private static List<Pattern> compile(List<String> globs) {
        return globs.stream()
                    .map(LintContext::globToRegex)
                    .map(Pattern::compile)
                    .toList();
    }

    private static String globToRegex(String glob) {
        // Placeholder keeps ** intact while single * is rewritten
        return glob.replace(".", "\\.")
                   .replace("**", "\0DOTSTAR\0")
                   .replace("*", "[^/]*")
                   .replace("?", "[^/]")
                   .replace("\0DOTSTAR\0", ".*");
    }
}
