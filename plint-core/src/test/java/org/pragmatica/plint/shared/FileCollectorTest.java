package org.pragmatica.plint.shared;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCollectorTest {

    @Test
    void collectPerlFiles_walksDirectories_inSortedOrder(@TempDir Path dir) throws IOException {
        var lib = Files.createDirectories(dir.resolve("lib/App"));
        var module = Files.writeString(lib.resolve("Reader.pm"), "1;\n");
        var script = Files.writeString(dir.resolve("run.pl"), "print 1;\n");
        var test = Files.writeString(Files.createDirectories(dir.resolve("t"))
                                          .resolve("basic.t"), "ok(1);\n");
        var app = Files.writeString(dir.resolve("app.psgi"), "sub {};\n");
        Files.writeString(dir.resolve("README.md"), "# readme\n");

        var errors = new ArrayList<PlintError>();
        var files = FileCollector.collectPerlFiles(List.of(dir), errors::add);

        assertThat(files).containsExactly(app, module, script, test);
        assertThat(errors).isEmpty();
    }

    @Test
    void collectPerlFiles_keepsExplicitFiles_whateverTheirName(@TempDir Path dir) throws IOException {
        var script = Files.writeString(dir.resolve("deploy"), "#!/usr/bin/perl\nprint 1;\n");
        var errors = new ArrayList<PlintError>();
        assertThat(FileCollector.collectPerlFiles(List.of(script), errors::add)).containsExactly(script);
    }

    @Test
    void collectPerlFiles_reportsMissingPaths(@TempDir Path dir) {
        var errors = new ArrayList<PlintError>();
        var files = FileCollector.collectPerlFiles(List.of(dir.resolve("nope")), errors::add);
        assertThat(files).isEmpty();
        assertThat(errors).singleElement()
                          .isInstanceOf(PlintError.SourceReadFailed.class);
    }

    @Test
    void isPerlFile_checksExtension() {
        assertThat(FileCollector.isPerlFile(Path.of("a/Foo.pm"))).isTrue();
        assertThat(FileCollector.isPerlFile(Path.of("a/foo.pl"))).isTrue();
        assertThat(FileCollector.isPerlFile(Path.of("t/foo.t"))).isTrue();
        assertThat(FileCollector.isPerlFile(Path.of("foo.txt"))).isFalse();
    }

    @Test
    void read_failsWithSourceReadFailed(@TempDir Path dir) {
        assertThatThrownBy(() -> SourceFile.read(dir.resolve("absent.pl")))
                  .isInstanceOf(PlintException.class)
                  .extracting(e -> ((PlintException) e).error())
                  .isInstanceOf(PlintError.SourceReadFailed.class);
    }
}
