package org.pragmatica.plint.config;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.pragmatica.plint.lint.DiagnosticSeverity;
import org.pragmatica.plint.lint.LintConfig;
import org.pragmatica.plint.shared.PlintError;
import org.pragmatica.plint.shared.PlintException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Loads [PlintConfig] from TOML.
///
/// ```toml
/// exclude = ["blib/**"]
///
/// [lint]
/// fail-on-warning = true
/// minimum-severity = "warning"
/// themes = ["trw"]
/// disabled-rules = []
/// parallel = false
///
/// [lint.severities]
/// "ControlStructures::ProhibitForeachHandle" = "error"
/// ```
///
/// Missing keys keep their defaults and unknown keys are ignored.
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {}

    /// Load an explicitly named file; a missing file is an error.
    public static PlintConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PlintException(PlintError.configNotFound(path.toString()));
        }
        try {
            log.debug("Loading configuration from {}", path);
            return parse(Files.readString(path), path.toString());
        } catch (IOException e) {
            throw new PlintException(PlintError.configParseFailed(path.toString(), e.getMessage()), e);
        }
    }

    /// Load the given file, or `plint.toml` in the working directory when present, or defaults.
    public static PlintConfig loadOrDefault(Optional<Path> path) {
        if (path.isPresent()) {
            return load(path.get());
        }
        var local = Path.of(PlintConfig.DEFAULT_FILE_NAME);
        if (Files.isRegularFile(local)) {
            return load(local);
        }
        log.debug("No {} found, using defaults", PlintConfig.DEFAULT_FILE_NAME);
        return PlintConfig.defaultConfig();
    }

    public static PlintConfig parse(String content) {
        return parse(content, "inline");
    }

    private static PlintConfig parse(String content, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (JacksonException e) {
            throw new PlintException(PlintError.configParseFailed(source, e.getOriginalMessage()), e);
        }
        var exclude = strings(root.path("exclude"), "exclude");
        var lint = lintConfig(root.path("lint"));
        return new PlintConfig(lint, exclude);
    }

    private static LintConfig lintConfig(JsonNode lint) {
        var defaults = LintConfig.defaultConfig();
        if (lint.isMissingNode()) {
            return defaults;
        }
        var severities = new HashMap<String, DiagnosticSeverity>();
        lint.path("severities")
            .fields()
            .forEachRemaining(entry -> severities.put(entry.getKey(),
                                                      severity("lint.severities." + entry.getKey(),
                                                               entry.getValue()
                                                                    .asText())));
        var minimumSeverity = lint.has("minimum-severity")
                              ? severity("lint.minimum-severity",
                                         lint.get("minimum-severity")
                                             .asText())
                              : defaults.minimumSeverity();
        return new LintConfig(severities,
                              new HashSet<>(strings(lint.path("disabled-rules"), "lint.disabled-rules")),
                              minimumSeverity,
                              new HashSet<>(strings(lint.path("themes"), "lint.themes")),
                              flag(lint, "fail-on-warning", defaults.failOnWarning()),
                              flag(lint, "parallel", defaults.parallel()));
    }

    static DiagnosticSeverity severity(String key, String value) {
        return DiagnosticSeverity.severity(value)
                                 .orElseThrow(() -> new PlintException(PlintError.invalidValue(key,
                                                                                               value,
                                                                                               "one of info, warning, error")));
    }

    private static boolean flag(JsonNode node, String key, boolean defaultValue) {
        var value = node.path(key);
        if (value.isMissingNode()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new PlintException(PlintError.invalidValue("lint." + key, value.asText(), "true or false"));
        }
        return value.booleanValue();
    }

    private static List<String> strings(JsonNode node, String key) {
        if (node.isMissingNode()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new PlintException(PlintError.invalidValue(key, node.asText(), "an array of strings"));
        }
        var values = new ArrayList<String>();
        node.forEach(item -> values.add(item.asText()));
        return values;
    }
}
