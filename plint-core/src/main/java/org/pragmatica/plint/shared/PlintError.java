package org.pragmatica.plint.shared;

/// Failures of the host layer: reading sources, loading configuration.
///
/// Rule analysis itself never fails; a shape it does not recognize simply produces
/// no diagnostics.
public sealed interface PlintError {
    String message();

    /// Explicitly requested configuration file does not exist.
    record ConfigNotFound(String path) implements PlintError {
        @Override
        public String message() {
            return "Config file not found: " + path;
        }
    }

    /// Configuration file exists but is not valid TOML.
    record ConfigParseFailed(String source, String reason) implements PlintError {
        @Override
        public String message() {
            return "Failed to parse config '" + source + "': " + reason;
        }
    }

    /// A configuration value or command line option has an unusable value.
    record InvalidValue(String key, String value, String expected) implements PlintError {
        @Override
        public String message() {
            return "Invalid value '" + value + "' for '" + key + "': expected " + expected;
        }
    }

    /// Source file could not be read.
    record SourceReadFailed(String path, String reason) implements PlintError {
        @Override
        public String message() {
            return "Failed to read '" + path + "': " + reason;
        }
    }

    /// Directory could not be walked while collecting sources.
    record DirectoryScanFailed(String path, String reason) implements PlintError {
        @Override
        public String message() {
            return "Error scanning " + path + ": " + reason;
        }
    }

    static ConfigNotFound configNotFound(String path) {
        return new ConfigNotFound(path);
    }

    static ConfigParseFailed configParseFailed(String source, String reason) {
        return new ConfigParseFailed(source, reason);
    }

    static InvalidValue invalidValue(String key, String value, String expected) {
        return new InvalidValue(key, value, expected);
    }

    static SourceReadFailed sourceReadFailed(String path, Throwable cause) {
        return new SourceReadFailed(path, String.valueOf(cause.getMessage()));
    }

    static DirectoryScanFailed directoryScanFailed(String path, Throwable cause) {
        return new DirectoryScanFailed(path, String.valueOf(cause.getMessage()));
    }
}
