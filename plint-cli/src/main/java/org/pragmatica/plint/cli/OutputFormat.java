package org.pragmatica.plint.cli;

/// Report format selectable with `--format`.
public enum OutputFormat {
    TEXT,
    JSON
}
