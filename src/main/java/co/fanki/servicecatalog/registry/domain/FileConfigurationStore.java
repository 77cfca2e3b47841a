package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Keeps one configuration file per service in a base directory.
 *
 * <p>JSON texts are written to {@code <name>.json}, anything else to
 * {@code <name>.yaml}. Saving a service removes its file under the other
 * extension so a name never maps to two files.</p>
 *
 * <p>Service names are restricted to letters, digits, dots, dashes and
 * underscores; any other name is rejected with a
 * {@link ConfigurationStoreException}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FileConfigurationStore implements ConfigurationStore {

    private static final Logger LOG = LoggerFactory.getLogger(
            FileConfigurationStore.class);

    private static final List<String> EXTENSIONS =
            List.of(".json", ".yaml", ".yml");

    private static final Pattern VALID_NAME =
            Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path baseDirectory;

    /**
     * Creates the store, creating the base directory when missing.
     *
     * @param theBaseDirectory the directory holding the files
     * @throws ConfigurationStoreException if the directory cannot be created
     */
    public FileConfigurationStore(final Path theBaseDirectory) {
        this.baseDirectory = Preconditions.requireNonNull(theBaseDirectory,
                "Base directory is required");
        try {
            Files.createDirectories(baseDirectory);
        } catch (final IOException e) {
            throw new ConfigurationStoreException(
                    "Failed to create config directory " + baseDirectory, e);
        }
    }

    @Override
    public String load(final String name) {
        final Path file = existingFile(name).orElseThrow(() ->
                new ConfigurationStoreException(
                        "Configuration file not found for service " + name,
                        null));
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new ConfigurationStoreException(
                    "Failed to read configuration file " + file, e);
        }
    }

    @Override
    public void save(final String name, final String text) {
        Preconditions.requireNonNull(text, "Configuration text is required");
        final String extension = text.stripLeading().startsWith("{")
                ? ".json" : ".yaml";
        final Path file = fileFor(name, extension);
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
            for (final String other : EXTENSIONS) {
                if (!other.equals(extension)) {
                    Files.deleteIfExists(fileFor(name, other));
                }
            }
        } catch (final IOException e) {
            throw new ConfigurationStoreException(
                    "Failed to write configuration file " + file, e);
        }
        LOG.debug("Saved configuration of service {} to {}", name, file);
    }

    @Override
    public List<String> list() {
        final TreeSet<String> names = new TreeSet<>();
        try (Stream<Path> files = Files.list(baseDirectory)) {
            files.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .forEach(fileName -> stripExtension(fileName)
                            .ifPresent(names::add));
        } catch (final IOException e) {
            throw new ConfigurationStoreException(
                    "Failed to read config directory " + baseDirectory, e);
        }
        return new ArrayList<>(names);
    }

    @Override
    public void delete(final String name) {
        for (final String extension : EXTENSIONS) {
            final Path file = fileFor(name, extension);
            try {
                Files.deleteIfExists(file);
            } catch (final IOException e) {
                throw new ConfigurationStoreException(
                        "Failed to delete configuration file " + file, e);
            }
        }
    }

    /** Returns the directory holding the configuration files. */
    public Path baseDirectory() {
        return baseDirectory;
    }

    private Optional<Path> existingFile(final String name) {
        for (final String extension : EXTENSIONS) {
            final Path file = fileFor(name, extension);
            if (Files.isRegularFile(file)) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    private Path fileFor(final String name, final String extension) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new ConfigurationStoreException(
                    "Invalid service name for storage: " + name, null);
        }
        return baseDirectory.resolve(name + extension);
    }

    private static Optional<String> stripExtension(final String fileName) {
        for (final String extension : EXTENSIONS) {
            if (fileName.endsWith(extension)
                    && fileName.length() > extension.length()) {
                return Optional.of(fileName.substring(0,
                        fileName.length() - extension.length()));
            }
        }
        return Optional.empty();
    }

}
