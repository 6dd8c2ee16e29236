package com.testflow.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testflow.flow.Flow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each flow as {@code <id>.json} in one directory.
 *
 * ## Writes
 * A snapshot is written to {@code <id>.json.tmp} and renamed over the target, so a
 * crash mid-write never leaves a truncated flow behind. A failed save throws
 * {@link UncheckedIOException}; the caller's edits would otherwise be lost silently.
 *
 * ## Reads
 * A file that cannot be parsed or restored is logged and treated as absent.
 * Hand-edits are picked up on the next {@link #load}; nothing is cached.
 */
public class JsonFlowRepository implements FlowRepository {

    private static final Logger log       = LoggerFactory.getLogger(JsonFlowRepository.class);
    private static final String EXTENSION = ".json";

    private final Path               directory;
    private final FlowSnapshotMapper snapshots;
    private final ObjectMapper       mapper;

    public JsonFlowRepository(Path directory, FlowSnapshotMapper snapshots) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("JsonFlowRepository: Could not create flow directory {}: {}", directory, e.getMessage());
        }
    }

    // ── FlowRepository ────────────────────────────────────────────────────────

    @Override
    public synchronized void save(Flow flow) {
        Path target = fileFor(flow.getId());
        Path tmp    = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            mapper.writeValue(tmp.toFile(), snapshots.toSnapshot(flow));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("JsonFlowRepository: saved flow '{}' to {}", flow.getName(), target);
        } catch (IOException e) {
            log.error("JsonFlowRepository: Failed to save flow '{}' to {}: {}", flow.getName(), target, e.getMessage());
            throw new UncheckedIOException("Failed to save flow " + flow.getId(), e);
        }
    }

    @Override
    public Optional<Flow> load(String id) {
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            log.debug("JsonFlowRepository: no flow file at {}", file);
            return Optional.empty();
        }
        try {
            FlowSnapshot snapshot = mapper.readValue(file.toFile(), FlowSnapshot.class);
            return Optional.of(snapshots.fromSnapshot(snapshot));
        } catch (IOException e) {
            log.warn("JsonFlowRepository: Failed to read {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (IllegalStateException e) {
            log.warn("JsonFlowRepository: Failed to restore {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(directory)) return new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(EXTENSION))
                .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("JsonFlowRepository: Failed to list {}: {}", directory, e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public synchronized boolean delete(String id) {
        Path file = fileFor(id);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) log.info("JsonFlowRepository: deleted flow {}", id);
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete flow " + id, e);
        }
    }

    public Path getDirectory() { return directory; }

    // ── Paths ─────────────────────────────────────────────────────────────────

    /** Ids become file names, so anything that could leave the directory is rejected. */
    private Path fileFor(String id) {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new IllegalArgumentException("Invalid flow id: '" + id + "'");
        }
        return directory.resolve(id + EXTENSION);
    }
}
