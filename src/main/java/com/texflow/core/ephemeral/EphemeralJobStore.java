package com.texflow.core.ephemeral;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.texflow.core.model.Engine;
import com.texflow.core.model.JobStatusChange;
import com.texflow.core.model.ParsedLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-area store for one-shot compiles.
 * <p>
 * Each job owns {@code <root>/async-compiles/<jobId>/} holding
 * {@code metadata.json}, the inline source, and once compiled the log,
 * the parsed errors and the PDF. Metadata is replaced atomically so
 * concurrent pollers see either the previous or the next version.
 * <p>
 * Every read honours {@code expiresAt}: an expired record and its artifacts
 * read as absent even before the reaper deletes them.
 */
@Service
public class EphemeralJobStore {

    private static final Logger log = LoggerFactory.getLogger(EphemeralJobStore.class);

    static final String DIRECTORY_NAME = "async-compiles";
    static final String METADATA_FILE = "metadata.json";
    static final String LOG_FILE = "compile.log";
    static final String ERRORS_FILE = "errors.json";
    static final Duration ORPHAN_GRACE = Duration.ofMinutes(1);

    private static final Pattern JOB_ID = Pattern.compile("^[A-Za-z0-9_-]{1,128}$");

    private final Path root;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public EphemeralJobStore(StorageProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getRoot()), Duration.ofMinutes(properties.getTtlMinutes()),
                objectMapper, Clock.systemUTC());
    }

    public EphemeralJobStore(Path storageRoot, Duration ttl, ObjectMapper objectMapper, Clock clock) {
        this.root = storageRoot.resolve(DIRECTORY_NAME);
        this.ttl = ttl;
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
    }

    public static boolean isValidJobId(String jobId) {
        return jobId != null && JOB_ID.matcher(jobId).matches();
    }

    /**
     * Creates the record in {@code queued} state and writes the inline source
     * as {@code mainFile}.
     */
    public EphemeralJobRecord create(String jobId, String userId, Engine requestedEngine,
                                     String mainFile, String source) {
        var record = EphemeralJobRecord.queued(jobId, userId, requestedEngine, mainFile, clock.instant(), ttl);
        Path dir = jobDirectory(jobId);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(mainFile), source, StandardCharsets.UTF_8);
            writeMetadata(dir, record);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create ephemeral job " + jobId, e);
        }
        log.debug("Created ephemeral job {} (expires {})", jobId, record.expiresAt());
        return record;
    }

    /**
     * Applies a status transition. Transitions that would move backwards or
     * leave a terminal state are ignored and the stored record is returned.
     */
    public synchronized Optional<EphemeralJobRecord> patch(String jobId, JobStatusChange change) {
        Optional<EphemeralJobRecord> current = readMetadata(jobId);
        if (current.isEmpty()) {
            log.warn("Cannot patch ephemeral job {}: no metadata", jobId);
            return Optional.empty();
        }
        var existing = current.get();
        boolean sameState = existing.status() == change.status() && !existing.isTerminal();
        if (!sameState && !existing.status().canTransitionTo(change.status())) {
            log.info("Ignoring transition {} -> {} for ephemeral job {}",
                    existing.status().wireName(), change.status().wireName(), jobId);
            return current;
        }
        var updated = existing.apply(change, ttl, clock.instant());
        try {
            writeMetadata(jobDirectory(jobId), updated);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update ephemeral job " + jobId, e);
        }
        return Optional.of(updated);
    }

    public Optional<EphemeralJobRecord> read(String jobId) {
        return readMetadata(jobId).filter(record -> !record.isExpired(clock.instant()));
    }

    public void delete(String jobId) {
        if (!isValidJobId(jobId)) {
            return;
        }
        deleteRecursively(jobDirectory(jobId));
        log.debug("Deleted ephemeral job {}", jobId);
    }

    public void writeLogs(String jobId, String logs) {
        writeArtifact(jobId, LOG_FILE, logs == null ? "" : logs);
    }

    public void writeErrors(String jobId, List<ParsedLogEntry> entries) {
        try {
            writeArtifact(jobId, ERRORS_FILE, objectMapper.writeValueAsString(entries));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize errors for job " + jobId, e);
        }
    }

    public Optional<String> readLogs(String jobId) {
        return readArtifact(jobId, LOG_FILE).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public List<ParsedLogEntry> readErrors(String jobId) {
        return readArtifact(jobId, ERRORS_FILE).map(bytes -> {
            try {
                return objectMapper.readValue(bytes, new TypeReference<List<ParsedLogEntry>>() {});
            } catch (IOException e) {
                log.warn("Unreadable errors file for job {}: {}", jobId, e.getMessage());
                return List.<ParsedLogEntry>of();
            }
        }).orElse(List.of());
    }

    /** The compiled PDF, named after the record's main file. */
    public Optional<byte[]> readPdf(String jobId) {
        return read(jobId).flatMap(record -> readArtifact(jobId, pdfName(record.mainFile())));
    }

    public Path jobDirectory(String jobId) {
        if (!isValidJobId(jobId)) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return root.resolve(jobId);
    }

    /**
     * Job ids whose directories should be removed: expired records and
     * directories left without metadata.
     */
    public List<String> listExpired() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        Instant now = clock.instant();
        var expired = new ArrayList<String>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory).forEach(dir -> {
                String jobId = dir.getFileName().toString();
                if (!isValidJobId(jobId)) {
                    return;
                }
                Optional<EphemeralJobRecord> record = readMetadata(jobId);
                if (record.map(r -> r.isExpired(now)).orElseGet(() -> isOrphan(dir, now))) {
                    expired.add(jobId);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list ephemeral jobs", e);
        }
        return expired;
    }

    public int purgeExpired() {
        var expired = listExpired();
        expired.forEach(this::delete);
        if (!expired.isEmpty()) {
            log.info("Purged {} expired ephemeral job(s)", expired.size());
        }
        return expired.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    static String pdfName(String mainFile) {
        String base = mainFile.endsWith(".tex") ? mainFile.substring(0, mainFile.length() - 4) : mainFile;
        return base + ".pdf";
    }

    private Optional<EphemeralJobRecord> readMetadata(String jobId) {
        if (!isValidJobId(jobId)) {
            return Optional.empty();
        }
        Path file = jobDirectory(jobId).resolve(METADATA_FILE);
        try {
            return Optional.of(objectMapper.readValue(Files.readAllBytes(file), EphemeralJobRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable metadata for ephemeral job {}: {}", jobId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<byte[]> readArtifact(String jobId, String name) {
        if (read(jobId).isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(jobDirectory(jobId).resolve(name)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + name + " of job " + jobId, e);
        }
    }

    private void writeArtifact(String jobId, String name, String content) {
        try {
            Files.writeString(jobDirectory(jobId).resolve(name), content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + name + " of job " + jobId, e);
        }
    }

    private void writeMetadata(Path dir, EphemeralJobRecord record) throws IOException {
        Path tmp = dir.resolve(METADATA_FILE + ".tmp");
        Files.write(tmp, objectMapper.writeValueAsBytes(record));
        try {
            Files.move(tmp, dir.resolve(METADATA_FILE),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, dir.resolve(METADATA_FILE), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isOrphan(Path dir, Instant now) {
        try {
            return Files.getLastModifiedTime(dir).toInstant().plus(ORPHAN_GRACE).isBefore(now);
        } catch (IOException e) {
            return false;
        }
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + dir, e);
        }
    }
}
