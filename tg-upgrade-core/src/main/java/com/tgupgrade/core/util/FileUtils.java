package com.tgupgrade.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds every file with the given name below a root directory, the root included.
     *
     * @param rootPath root directory to search from
     * @param fileName exact file name, e.g. {@code terraform.tfvars}
     * @return sorted list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFilesNamed(Path rootPath, String fileName) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().equals(fileName))
                .sorted()
                .toList();
        }
    }
}
