package com.texflow.dispatch.api;

import com.texflow.core.model.CompileJob;
import com.texflow.core.queue.CancelResult;
import com.texflow.core.submission.BuildRequest;
import com.texflow.core.submission.CompileSubmissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for project builds. Build state is owned by the
 * {@link com.texflow.core.worker.ProjectPersistenceHook}; this controller
 * only submits and cancels.
 */
@RestController
@RequestMapping("/api/v1/builds")
public class BuildController {

    private final CompileSubmissionService submissionService;

    public BuildController(CompileSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    /**
     * POST /api/v1/builds queues a build of a project directory.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody BuildRequest request) {
        CompileJob job = submissionService.submitBuild(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("buildId", job.jobId());
        body.put("status", "queued");
        body.put("mainFile", job.mainFile());
        body.put("engine", job.requestedEngine().wireName());
        body.put("cancelUrl", "/api/v1/builds/" + job.jobId() + "/cancel");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    /**
     * POST /api/v1/builds/{buildId}/cancel
     */
    @PostMapping("/{buildId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String buildId) {
        CancelResult result = submissionService.cancelBuild(buildId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("buildId", buildId);
        body.put("wasQueued", result.wasQueued());
        body.put("wasRunning", result.wasRunning());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
}
