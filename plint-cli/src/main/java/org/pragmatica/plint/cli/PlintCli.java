package org.pragmatica.plint.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Command-line entry point.
///
/// ```
/// plint lint lib/ script.pl
/// plint check --config ci/plint.toml lib/
/// plint rules
/// ```
@Command(name = "plint",
mixinStandardHelpOptions = true,
version = "plint 0.1.0",
description = "Static checks for Perl sources",
subcommands = {LintCommand.class,
CheckCommand.class,
RulesCommand.class})
public class PlintCli implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine() {
        return new CommandLine(new PlintCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }
}
