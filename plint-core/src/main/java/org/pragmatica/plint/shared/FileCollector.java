package org.pragmatica.plint.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Utility for collecting Perl source files from paths.
 */
public final class FileCollector {
    private static final Set<String> PERL_EXTENSIONS = Set.of(".pl", ".pm", ".t", ".psgi");

    private FileCollector() {}

    /**
     * Collect Perl files from a list of paths (files or directories).
     * Directories are scanned recursively; files given explicitly are kept whatever their extension.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return Sorted list of Perl file paths
     */
    public static List<Path> collectPerlFiles(List<Path> paths, Consumer<PlintError> errorHandler) {
        var files = new ArrayList<Path>();

        for (var path : paths) {
            if (Files.isDirectory(path)) {
                collectFromDirectory(path, files, errorHandler);
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                errorHandler.accept(PlintError.sourceReadFailed(path.toString(),
                                                                new IOException("No such file or directory")));
            }
        }

        return files;
    }

    public static boolean isPerlFile(Path path) {
        var name = path.getFileName()
                       .toString();
        return PERL_EXTENSIONS.stream()
                              .anyMatch(name::endsWith);
    }

    private static void collectFromDirectory(Path directory, List<Path> files, Consumer<PlintError> errorHandler) {
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile)
                .filter(FileCollector::isPerlFile)
                .sorted()
                .forEach(files::add);
        } catch (IOException | UncheckedIOException e) {
            errorHandler.accept(PlintError.directoryScanFailed(directory.toString(), e));
        }
    }
}
