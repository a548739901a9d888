package com.mco.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mco.core.model.Orchestration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * State store that keeps one JSON document per orchestration at {@code <directory>/<id>.json}.
 * Writes go to a temporary file that is then moved over the target, so readers never see
 * a half-written document.
 */
public class FileStateStore extends AbstractStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileStateStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileStateStore(Path directory, Clock clock) {
        super(clock);
        this.directory = directory.toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new StateStoreException("Cannot create state directory " + this.directory, e);
        }
        log.info("File state store at {}", this.directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    protected Optional<Orchestration> read(String id) {
        if (!isSafeId(id)) {
            return Optional.empty();
        }
        Path file = fileFor(id);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Orchestration.class));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state for " + id + " from " + file, e);
        }
    }

    @Override
    protected void write(Orchestration orchestration) {
        Path target = fileFor(requireSafeId(orchestration.id()));
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, orchestration.id(), ".tmp");
            objectMapper.writeValue(temp.toFile(), orchestration);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StateStoreException("Failed to write state for " + orchestration.id() + " to " + target, e);
        }
    }

    @Override
    protected boolean remove(String id) {
        if (!isSafeId(id)) {
            return false;
        }
        try {
            return Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new StateStoreException("Failed to delete state for " + id, e);
        }
    }

    @Override
    protected List<String> ids() {
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .forEach(ids::add);
        } catch (IOException e) {
            throw new StateStoreException("Failed to list state directory " + directory, e);
        }
        return ids;
    }

    private Path fileFor(String id) {
        return directory.resolve(id + SUFFIX);
    }

    private static boolean isSafeId(String id) {
        return id != null && !id.isBlank()
                && !id.contains("/") && !id.contains("\\") && !id.contains("..");
    }

    private static String requireSafeId(String id) {
        if (!isSafeId(id)) {
            throw new IllegalArgumentException("Orchestration id not usable as a file name: " + id);
        }
        return id;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary state file {}: {}", temp, e.getMessage());
        }
    }
}
