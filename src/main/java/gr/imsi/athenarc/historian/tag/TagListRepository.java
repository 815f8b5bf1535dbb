package gr.imsi.athenarc.historian.tag;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named tag lists stored as {@code <name>.txt} files with one tag per line. Updates and deletes
 * keep the previous content as {@code <name>.txt.bak}.
 */
public class TagListRepository {

    private static final Logger LOG = LoggerFactory.getLogger(TagListRepository.class);

    private static final String EXTENSION = ".txt";
    private static final String BACKUP_EXTENSION = ".bak";

    private final Path directory;

    public TagListRepository(Path directory) {
        this.directory = directory;
        try {
            if (!Files.exists(directory)) {
                Files.createDirectories(directory);
                LOG.info("Created configuration directory: {}", directory);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create configuration directory " + directory, e);
        }
    }

    public List<String> list() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list configurations in " + directory, e);
        }
    }

    /**
     * Returns the non-empty, trimmed lines of the list, or an empty list if it does not exist.
     */
    public List<String> read(String name) {
        Path file = resolve(name);
        if (!Files.exists(file)) {
            LOG.error("Configuration file {} not found", name);
            return Collections.emptyList();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + name, e);
        }
    }

    public boolean exists(String name) {
        return Files.exists(resolve(name));
    }

    /**
     * @return {@code false} if a list with this name already exists
     */
    public boolean create(String name, List<String> tags) {
        Path file = resolve(name);
        if (Files.exists(file)) {
            LOG.error("Configuration file {} already exists", file.getFileName());
            return false;
        }
        write(file, tags);
        LOG.info("Created configuration file: {}", file.getFileName());
        return true;
    }

    /**
     * Replaces the tags of an existing list. The previous content is restored if writing fails.
     *
     * @return {@code false} if the list does not exist
     */
    public boolean update(String name, List<String> tags) {
        Path file = resolve(name);
        if (!Files.exists(file)) {
            LOG.error("Configuration file {} not found", name);
            return false;
        }
        Path backup = backup(file);
        try {
            write(file, tags);
        } catch (UncheckedIOException e) {
            try {
                Files.copy(backup, file, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException restoreError) {
                e.addSuppressed(restoreError);
            }
            throw e;
        }
        LOG.info("Updated configuration file: {}", file.getFileName());
        return true;
    }

    /**
     * @return {@code false} if the list does not exist
     */
    public boolean delete(String name) {
        Path file = resolve(name);
        if (!Files.exists(file)) {
            LOG.error("Configuration file {} not found", name);
            return false;
        }
        backup(file);
        try {
            Files.delete(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete configuration " + name, e);
        }
        LOG.info("Deleted configuration file: {}", file.getFileName());
        return true;
    }

    public Path getDirectory() {
        return directory;
    }

    private Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Configuration name is required");
        }
        String fileName = name.trim().endsWith(EXTENSION) ? name.trim() : name.trim() + EXTENSION;
        Path file = directory.resolve(fileName).normalize();
        if (!directory.toAbsolutePath().normalize().equals(file.toAbsolutePath().getParent())) {
            throw new IllegalArgumentException("Invalid configuration name: " + name);
        }
        return file;
    }

    private Path backup(Path file) {
        Path backup = file.resolveSibling(file.getFileName() + BACKUP_EXTENSION);
        try {
            return Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to back up configuration " + file.getFileName(), e);
        }
    }

    private static void write(Path file, List<String> tags) {
        List<String> lines = tags.stream()
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toList());
        try {
            Files.write(file, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration " + file.getFileName(), e);
        }
    }
}
