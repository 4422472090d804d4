package org.example.mjcf;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileUtils {

    static final String ASSEMBLY_SUFFIX = ".json";

    /**
     * Recursively collects all assembly descriptions (*.json) under {@code dir},
     * sorted by depth and then path so output order is reproducible.
     */
    public static List<Path> collectAssemblyFiles(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(p -> Files.isRegularFile(p)
                          && p.getFileName().toString().endsWith(ASSEMBLY_SUFFIX))
                .sorted(Comparator.comparingInt(Path::getNameCount)
                                  .thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            Logger.error("Failed to scan directory '%s': %s", dir, e.getMessage());
            return List.of();
        }
    }

    /** File name without the assembly suffix, used for the default output name. */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(ASSEMBLY_SUFFIX)
            ? name.substring(0, name.length() - ASSEMBLY_SUFFIX.length())
            : name;
    }
}
