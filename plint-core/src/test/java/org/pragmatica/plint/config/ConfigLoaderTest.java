package org.pragmatica.plint.config;

import org.pragmatica.plint.lint.DiagnosticSeverity;
import org.pragmatica.plint.shared.PlintError;
import org.pragmatica.plint.shared.PlintException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    void parse_readsAllSections() {
        var config = ConfigLoader.parse("""
            exclude = ["blib/**", "local/**"]

            [lint]
            fail-on-warning = true
            minimum-severity = "warning"
            themes = ["trw"]
            disabled-rules = ["Some::Rule"]
            parallel = true

            [lint.severities]
            "ControlStructures::ProhibitForeachHandle" = "error"
            """);
        var lint = config.lint();
        assertThat(config.exclude()).containsExactly("blib/**", "local/**");
        assertThat(lint.failOnWarning()).isTrue();
        assertThat(lint.parallel()).isTrue();
        assertThat(lint.minimumSeverity()).isEqualTo(DiagnosticSeverity.WARNING);
        assertThat(lint.themes()).containsExactly("trw");
        assertThat(lint.disabledRules()).containsExactly("Some::Rule");
        assertThat(lint.ruleSeverities()).containsEntry("ControlStructures::ProhibitForeachHandle",
                                                        DiagnosticSeverity.ERROR);
    }

    @Test
    void parse_keepsDefaults_forMissingKeys() {
        assertThat(ConfigLoader.parse("")).isEqualTo(PlintConfig.defaultConfig());
        var config = ConfigLoader.parse("""
            [lint]
            fail-on-warning = true
            """);
        assertThat(config.lint()
                         .minimumSeverity()).isEqualTo(DiagnosticSeverity.INFO);
        assertThat(config.exclude()).isEmpty();
    }

    @Test
    void parse_rejectsInvalidToml() {
        assertThatThrownBy(() -> ConfigLoader.parse("[lint\nfail-on-warning = "))
                  .isInstanceOf(PlintException.class)
                  .extracting(e -> ((PlintException) e).error())
                  .isInstanceOf(PlintError.ConfigParseFailed.class);
    }

    @Test
    void parse_rejectsUnknownSeverity() {
        assertThatThrownBy(() -> ConfigLoader.parse("""
            [lint]
            minimum-severity = "fatal"
            """))
                  .isInstanceOf(PlintException.class)
                  .hasMessageContaining("lint.minimum-severity")
                  .hasMessageContaining("fatal");
    }

    @Test
    void parse_rejectsWrongTypes() {
        assertThatThrownBy(() -> ConfigLoader.parse("""
            [lint]
            fail-on-warning = "yes"
            """))
                  .isInstanceOf(PlintException.class)
                  .hasMessageContaining("lint.fail-on-warning");
        assertThatThrownBy(() -> ConfigLoader.parse("exclude = \"blib\""))
                  .isInstanceOf(PlintException.class)
                  .hasMessageContaining("exclude");
    }

    @Test
    void load_readsFile(@TempDir Path dir) throws IOException {
        var file = Files.writeString(dir.resolve("plint.toml"), """
            [lint]
            minimum-severity = "error"
            """);
        assertThat(ConfigLoader.load(file)
                               .lint()
                               .minimumSeverity()).isEqualTo(DiagnosticSeverity.ERROR);
        assertThat(ConfigLoader.loadOrDefault(Optional.of(file))
                               .lint()
                               .minimumSeverity()).isEqualTo(DiagnosticSeverity.ERROR);
    }

    @Test
    void load_failsForMissingFile(@TempDir Path dir) {
        var missing = dir.resolve("absent.toml");
        assertThatThrownBy(() -> ConfigLoader.load(missing))
                  .isInstanceOf(PlintException.class)
                  .extracting(e -> ((PlintException) e).error())
                  .isEqualTo(PlintError.configNotFound(missing.toString()));
    }

    @Test
    void toContext_carriesExcludesAndLintConfig() {
        var config = ConfigLoader.parse("exclude = [\"blib/**\"]");
        var context = config.toContext();
        assertThat(context.shouldLint(Path.of("blib/x.pl"))).isFalse();
        assertThat(context.config()).isEqualTo(config.lint());
    }
}
