package com.texflow.core.worker;

import com.texflow.core.ephemeral.StorageProperties;
import com.texflow.core.model.CompileJob;
import com.texflow.core.model.JobKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Prepares the host directory a compile container mounts.
 * <p>
 * Ephemeral jobs already live in their own store directory and compile in
 * place. Project builds are copied into {@code <root>/builds/<jobId>} so that
 * concurrent builds of one project never share auxiliary files; only the
 * finished PDF is copied back.
 */
@Component
public class WorkspaceStager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStager.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(".git", ".texflow");

    private final Path buildsRoot;

    @Autowired
    public WorkspaceStager(StorageProperties properties) {
        this(Path.of(properties.getRoot()).resolve("builds"));
    }

    WorkspaceStager(Path buildsRoot) {
        this.buildsRoot = buildsRoot;
    }

    public Path prepare(CompileJob job) {
        Path source = Path.of(job.sourceLocation());
        if (job.kind() == JobKind.EPHEMERAL) {
            return source;
        }
        if (!Files.isDirectory(source)) {
            throw new IllegalStateException("Project directory not found: " + source);
        }
        Path target = buildsRoot.resolve(job.jobId());
        try {
            deleteTree(target);
            copyTree(source, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stage project " + source, e);
        }
        log.debug("Staged {} into {}", source, target);
        return target;
    }

    /**
     * Makes a successful build's PDF visible to its owner.
     *
     * @return the location reported in the completion event
     */
    public String publishPdf(CompileJob job, Path pdf) {
        if (job.kind() == JobKind.EPHEMERAL) {
            return "/api/v1/compile/" + job.jobId() + "/output?format=pdf";
        }
        Path target = Path.of(job.sourceLocation()).resolve(job.pdfFileName());
        try {
            Files.createDirectories(target.getParent());
            Files.copy(pdf, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy PDF to " + target, e);
        }
        return target.toString();
    }

    public void cleanup(CompileJob job, Path workDir) {
        if (job.kind() == JobKind.EPHEMERAL || workDir == null) {
            return;
        }
        try {
            deleteTree(workDir);
        } catch (IOException e) {
            log.warn("Could not remove build directory {}: {}", workDir, e.getMessage());
        }
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (attrs.isRegularFile()) {
                    Files.copy(file, target.resolve(source.relativize(file).toString()),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
