package com.texflow.dispatch.api;

import com.texflow.core.ephemeral.EphemeralJobRecord;
import com.texflow.core.ephemeral.EphemeralJobStore;
import com.texflow.core.errors.ValidationException;
import com.texflow.core.logparser.LatexLogParser;
import com.texflow.core.model.JobStatus;
import com.texflow.core.model.ParsedLogEntry;
import com.texflow.core.submission.CompileSubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * REST controller for one-shot compiles: submit, poll, fetch output, cancel.
 */
@RestController
@RequestMapping("/api/v1/compile")
public class CompileController {

    private static final Logger log = LoggerFactory.getLogger(CompileController.class);

    static final String USER_HEADER = "X-User-Id";
    private static final Set<String> OUTPUT_FORMATS = Set.of("pdf", "base64", "json");

    private final CompileSubmissionService submissionService;
    private final EphemeralJobStore store;

    public CompileController(CompileSubmissionService submissionService, EphemeralJobStore store) {
        this.submissionService = submissionService;
        this.store = store;
    }

    /**
     * POST /api/v1/compile with a JSON body {@code {source, engine}}.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> submitJson(
            @RequestBody CompileRequest request,
            @RequestParam(name = "engine", required = false) String engineParam,
            @RequestParam(name = "format", required = false) String format,
            @RequestHeader(name = USER_HEADER, required = false) String userId) {
        rejectFormat(format != null ? format : request.format());
        String engine = engineParam != null ? engineParam : request.engine();
        return accepted(submissionService.submitEphemeral(request.source(), engine, userId));
    }

    /**
     * POST /api/v1/compile with multipart field {@code file} and optional {@code engine}.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> submitFile(
            @RequestPart("file") MultipartFile file,
            @RequestParam(name = "engine", required = false) String engine,
            @RequestParam(name = "format", required = false) String format,
            @RequestHeader(name = USER_HEADER, required = false) String userId) throws IOException {
        rejectFormat(format);
        String source = new String(file.getBytes(), StandardCharsets.UTF_8);
        return accepted(submissionService.submitEphemeral(source, engine, userId));
    }

    /**
     * GET /api/v1/compile/{jobId}, poll status.
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<Map<String, Object>> getJob(
            @PathVariable String jobId,
            @RequestHeader(name = USER_HEADER, required = false) String userId) {
        Optional<EphemeralJobRecord> found = findVisible(jobId, userId);
        if (found.isEmpty()) {
            return notFound();
        }
        EphemeralJobRecord record = found.get();
        String outputUrl = "/api/v1/compile/" + jobId + "/output";

        Map<String, Object> job = new LinkedHashMap<>();
        job.put("id", record.id());
        job.put("status", record.status().wireName());
        job.put("requestedEngine", record.requestedEngine().wireName());
        job.put("engineUsed", record.engineUsed() != null ? record.engineUsed().wireName() : null);
        job.put("warningCount", record.warningCount());
        job.put("errorCount", record.errorCount());
        job.put("durationMs", record.durationMs());
        job.put("exitCode", record.exitCode());
        job.put("message", record.message());
        job.put("createdAt", record.createdAt());
        job.put("startedAt", record.startedAt());
        job.put("completedAt", record.completedAt());
        job.put("expiresAt", record.expiresAt());

        Map<String, Object> links = new LinkedHashMap<>();
        links.put("output", outputUrl);
        links.put("pdf", record.status() == JobStatus.SUCCESS ? outputUrl + "?format=pdf" : null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job", job);
        body.put("links", links);
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/compile/{jobId}/output?format=pdf|base64|json
     */
    @GetMapping("/{jobId}/output")
    public ResponseEntity<?> getOutput(@PathVariable String jobId,
                                       @RequestParam(name = "format", defaultValue = "json") String format,
                                       @RequestHeader(name = USER_HEADER, required = false) String userId) {
        Optional<EphemeralJobRecord> found = findVisible(jobId, userId);
        if (found.isEmpty()) {
            return notFound();
        }
        if (!OUTPUT_FORMATS.contains(format)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid format. Use one of: pdf, base64, json"));
        }
        EphemeralJobRecord record = found.get();
        if (!record.isTerminal()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Compilation still in progress");
            body.put("status", record.status().wireName());
            body.put("pollUrl", "/api/v1/compile/" + jobId);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }

        String logs = store.readLogs(jobId).orElse("");
        List<ParsedLogEntry> entries = store.readErrors(jobId);
        if (entries.isEmpty() && !logs.isEmpty()) {
            entries = LatexLogParser.parse(logs);
        }
        Optional<byte[]> pdf = record.status() == JobStatus.SUCCESS ? store.readPdf(jobId) : Optional.empty();

        if (pdf.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", terminalErrorMessage(record.status()));
            body.put("status", record.status().wireName());
            body.put("engineUsed", record.engineUsed() != null ? record.engineUsed().wireName() : null);
            body.put("logs", logs);
            body.put("errors", LatexLogParser.errorsOnly(entries));
            body.put("durationMs", record.durationMs());
            return ResponseEntity.unprocessableEntity().body(body);
        }

        byte[] bytes = pdf.get();
        if ("pdf".equals(format)) {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_PDF)
                    .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"output.pdf\"")
                    .header("X-Compile-Duration-Ms", String.valueOf(record.durationMs() != null ? record.durationMs() : 0))
                    .header("X-Compile-Engine", record.engineUsed() != null ? record.engineUsed().wireName() : "unknown")
                    .header("X-Compile-Warnings", String.valueOf(record.warningCount()))
                    .header("X-Compile-Errors", String.valueOf(record.errorCount()))
                    .contentLength(bytes.length)
                    .body(bytes);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pdf", Base64.getEncoder().encodeToString(bytes));
        body.put("engineUsed", record.engineUsed() != null ? record.engineUsed().wireName() : null);
        body.put("logs", logs);
        body.put("errors", entries);
        body.put("durationMs", record.durationMs());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/compile/{jobId}/cancel
     */
    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @PathVariable String jobId,
            @RequestHeader(name = USER_HEADER, required = false) String userId) {
        if (findVisible(jobId, userId).isEmpty()) {
            return notFound();
        }
        return submissionService.cancelEphemeral(jobId)
                .map(outcome -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("jobId", outcome.jobId());
                    body.put("status", outcome.status().wireName());
                    body.put("message", outcome.message());
                    return outcome.accepted()
                            ? ResponseEntity.status(HttpStatus.ACCEPTED).body(body)
                            : ResponseEntity.ok(body);
                })
                .orElseGet(CompileController::notFound);
    }

    // Someone else's job answers exactly like a missing one.
    private Optional<EphemeralJobRecord> findVisible(String jobId, String userId) {
        Optional<EphemeralJobRecord> found = submissionService.poll(jobId);
        if (found.isPresent() && !found.get().isVisibleTo(userId)) {
            log.debug("Job {} hidden from caller {}", jobId, userId);
            return Optional.empty();
        }
        return found;
    }

    private static ResponseEntity<Map<String, Object>> accepted(EphemeralJobRecord record) {
        String jobId = record.id();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", jobId);
        body.put("status", JobStatus.QUEUED.wireName());
        body.put("message", "Compilation queued");
        body.put("pollUrl", "/api/v1/compile/" + jobId);
        body.put("outputUrl", "/api/v1/compile/" + jobId + "/output");
        body.put("cancelUrl", "/api/v1/compile/" + jobId + "/cancel");
        log.debug("Accepted compile {}", jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    private static void rejectFormat(String format) {
        if (format != null && !format.isBlank()) {
            throw new ValidationException("POST /api/v1/compile is asynchronous. Submit first, then use "
                    + "GET /api/v1/compile/:jobId/output?format=pdf|base64|json");
        }
    }

    static String terminalErrorMessage(JobStatus status) {
        return switch (status) {
            case TIMEOUT -> "Compilation timed out";
            case CANCELED -> "Compilation canceled";
            default -> "Compilation failed";
        };
    }

    private static ResponseEntity<Map<String, Object>> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Compile job not found"));
    }
}
