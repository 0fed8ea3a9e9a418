package org.pragmatica.plint.cli;

/// Process exit statuses.
final class ExitCode {
    static final int CLEAN = 0;
    static final int VIOLATIONS = 1;
    static final int FAILURE = 2;

    private ExitCode() {}
}
