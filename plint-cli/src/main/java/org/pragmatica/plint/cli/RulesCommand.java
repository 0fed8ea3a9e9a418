package org.pragmatica.plint.cli;

import org.pragmatica.plint.lint.rules.LintRule;
import org.pragmatica.plint.lint.rules.LintRules;

import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Lists the built-in rules.
@Command(name = "rules", description = "List available rules", mixinStandardHelpOptions = true)
public class RulesCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine()
                      .getOut();
        LintRules.all()
                 .forEach(rule -> out.println(describe(rule)));
        out.flush();
        return ExitCode.CLEAN;
    }

    static String describe(LintRule rule) {
        var themes = rule.themes()
                         .stream()
                         .sorted()
                         .collect(Collectors.joining(","));
        return rule.ruleId() + " [" + rule.defaultSeverity()
                                         .label() + "] (" + themes + ") - " + rule.description();
    }
}
