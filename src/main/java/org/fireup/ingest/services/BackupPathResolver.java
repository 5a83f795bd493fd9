package org.fireup.ingest.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a user-supplied backup location to the concrete file to parse.
 * <p>
 * A regular file is used as-is. A directory (a Firestore export folder) is searched depth-first,
 * children in name order, for a file named {@code preferredFileName}; failing that the first
 * regular file found is used.
 */
public class BackupPathResolver {

    public static final String DEFAULT_PREFERRED_FILE_NAME = "output-0";

    private static final Logger log = LoggerFactory.getLogger(BackupPathResolver.class);

    private final String preferredFileName;

    public BackupPathResolver() {
        this(DEFAULT_PREFERRED_FILE_NAME);
    }

    public BackupPathResolver(String preferredFileName) {
        this.preferredFileName = preferredFileName;
    }

    /**
     * Resolves a backup location.
     *
     * @param location a backup file or export directory
     * @return the file to parse
     * @throws NoSuchFileException if the location does not exist or the directory holds no file
     * @throws IOException if a directory cannot be listed
     */
    public Path resolve(Path location) throws IOException {
        if (Files.isRegularFile(location)) {
            return location;
        }
        if (!Files.isDirectory(location)) {
            throw new NoSuchFileException(location.toString());
        }

        Optional<Path> preferred = findFirst(location,
            p -> p.getFileName().toString().equals(preferredFileName));
        if (preferred.isPresent()) {
            log.info("Resolved backup directory {} to {}", location, preferred.get());
            return preferred.get();
        }
        Optional<Path> any = findFirst(location, p -> true);
        if (any.isPresent()) {
            log.info("No '{}' in {}, using {}", preferredFileName, location, any.get());
            return any.get();
        }
        throw new NoSuchFileException(location.toString(), null, "directory contains no backup file");
    }

    private static Optional<Path> findFirst(Path directory, Predicate<Path> matcher) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(directory)) {
            children = stream.sorted().collect(Collectors.toList());
        }
        for (Path child : children) {
            if (Files.isRegularFile(child)) {
                if (matcher.test(child)) {
                    return Optional.of(child);
                }
            } else if (Files.isDirectory(child)) {
                Optional<Path> found = findFirst(child, matcher);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }
}
