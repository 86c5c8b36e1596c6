package com.epgmerge.collectors.fetch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Staging area for downloaded and decompressed feeds. Deletions here are best-effort: a file that
 * cannot be removed is handed to the failure callback and the caller carries on.
 */
public class ScratchDirectory {
    private final Path root;

    public ScratchDirectory(Path root) {
        this.root = Objects.requireNonNull(root, "root is required");
    }

    public Path root() {
        return root;
    }

    /**
     * Returns a path for {@code fileName} that does not exist yet, appending {@code (1)}, {@code (2)}, ...
     * before the extension on collision.
     */
    public Path uniqueFile(String fileName) {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create scratch directory " + root, e);
        }
        Path candidate = root.resolve(fileName);
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        for (int i = 1; Files.exists(candidate); i++) {
            candidate = root.resolve(stem + "(" + i + ")" + extension);
        }
        return candidate;
    }

    /**
     * Creates the directory if needed and removes everything inside it.
     *
     * @return number of entries that could not be removed
     */
    public int clear(BiConsumer<Path, IOException> onFailure) {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            onFailure.accept(root, e);
            return 1;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(root)) {
            entries = walk.filter(path -> !path.equals(root))
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            onFailure.accept(root, e instanceof UncheckedIOException unchecked ? unchecked.getCause() : (IOException) e);
            return 1;
        }
        int failures = 0;
        for (Path entry : entries) {
            if (!delete(entry, onFailure)) {
                failures++;
            }
        }
        return failures;
    }

    public boolean delete(Path file, BiConsumer<Path, IOException> onFailure) {
        try {
            Files.deleteIfExists(file);
            return true;
        } catch (IOException e) {
            onFailure.accept(file, e);
            return false;
        }
    }
}
