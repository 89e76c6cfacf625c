package com.texflow.dispatch.api;

import com.texflow.core.errors.ValidationException;
import com.texflow.core.model.CompileJob;
import com.texflow.core.model.Engine;
import com.texflow.core.model.JobKind;
import com.texflow.core.queue.CancelResult;
import com.texflow.core.submission.BuildRequest;
import com.texflow.core.submission.CompileSubmissionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BuildController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class BuildControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CompileSubmissionService submissionService;

    @Test
    @DisplayName("POST /builds returns 202 with the build id")
    void submitBuild() throws Exception {
        when(submissionService.submitBuild(any(BuildRequest.class))).thenReturn(new CompileJob("build-7",
                JobKind.PROJECT, "/srv/projects/p1", "thesis.tex", Engine.XELATEX, "p1", "u1", null));

        mockMvc.perform(post("/api/v1/builds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"buildId":"build-7","projectDir":"/srv/projects/p1","mainFile":"thesis.tex","engine":"xelatex"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.buildId").value("build-7"))
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.mainFile").value("thesis.tex"))
                .andExpect(jsonPath("$.engine").value("xelatex"))
                .andExpect(jsonPath("$.cancelUrl").value("/api/v1/builds/build-7/cancel"));
    }

    @Test
    @DisplayName("POST /builds with an unsafe path returns 400")
    void submitBuildInvalid() throws Exception {
        when(submissionService.submitBuild(any(BuildRequest.class)))
                .thenThrow(new ValidationException("projectDir must be an absolute path"));

        mockMvc.perform(post("/api/v1/builds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectDir\":\"relative\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("projectDir must be an absolute path"));
    }

    @Test
    @DisplayName("POST /builds/{id}/cancel reports what was canceled")
    void cancelBuild() throws Exception {
        when(submissionService.cancelBuild("build-7")).thenReturn(CancelResult.running());

        mockMvc.perform(post("/api/v1/builds/build-7/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.buildId").value("build-7"))
                .andExpect(jsonPath("$.wasQueued").value(false))
                .andExpect(jsonPath("$.wasRunning").value(true));
    }
}
