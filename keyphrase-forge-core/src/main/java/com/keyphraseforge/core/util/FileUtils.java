package com.keyphraseforge.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
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
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against the path relative to the root. Results are sorted by
     * their relative path so that repeated walks return the same order.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, e.g. {@code *.json}
     * @return list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted(Comparator.comparing(path -> relativePath(rootPath, path)))
                .toList();
        }
    }

    /**
     * Returns the path of a file relative to a root, with forward slashes on every platform.
     *
     * @param rootPath root directory
     * @param path file below the root
     * @return relative path string
     */
    public static String relativePath(Path rootPath, Path path) {
        return rootPath.relativize(path).toString().replace('\\', '/');
    }

    /**
     * Checks whether two paths point to the same file, tolerating files that do not exist.
     *
     * @param a first path
     * @param b second path, may be null
     * @return true if both resolve to the same absolute, normalized path
     */
    public static boolean isSameFile(Path a, Path b) {
        if (b == null) {
            return false;
        }
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }
}
