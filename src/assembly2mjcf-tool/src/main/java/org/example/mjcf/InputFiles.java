package org.example.mjcf;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands command-line paths into assembly files: files are taken as given,
 * directories are scanned recursively. Duplicates are dropped, order kept.
 */
record InputFiles(List<Path> files, int missing) {

    static InputFiles expand(List<Path> inputs) {
        Set<Path> uniqueFiles = new LinkedHashSet<>();
        int missing = 0;

        for (Path input : inputs) {
            if (!Files.exists(input)) {
                System.err.printf("  [x]  Path not found: %s%n", input);
                missing++;
                continue;
            }
            if (Files.isDirectory(input)) {
                List<Path> found = FileUtils.collectAssemblyFiles(input);
                if (found.isEmpty()) {
                    System.err.printf("  [!]  No %s files found under: %s%n", FileUtils.ASSEMBLY_SUFFIX, input);
                } else {
                    Logger.info("Found %d assembly file(s) under: %s", found.size(), input);
                    uniqueFiles.addAll(found);
                }
            } else {
                uniqueFiles.add(input);
            }
        }
        return new InputFiles(new ArrayList<>(uniqueFiles), missing);
    }

    boolean isEmpty() {
        return files.isEmpty();
    }
}
