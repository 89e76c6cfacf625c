package com.texflow.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setJob puts jobId and jobKind in MDC")
    void setJob() {
        MdcContext.setJob("job-1", "ephemeral");
        assertEquals("job-1", MDC.get("jobId"));
        assertEquals("ephemeral", MDC.get("jobKind"));
    }

    @Test
    @DisplayName("setEngine and setWorker add their keys")
    void setEngineAndWorker() {
        MdcContext.setEngine("lualatex");
        MdcContext.setWorker("worker-7");
        assertEquals("lualatex", MDC.get("engine"));
        assertEquals("worker-7", MDC.get("workerId"));
    }

    @Test
    @DisplayName("clear removes only texflow keys")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setJob("job-1", "project");
        MdcContext.setEngine("pdflatex");
        MdcContext.setWorker("worker-7");

        MdcContext.clear();

        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("jobKind"));
        assertNull(MDC.get("engine"));
        assertNull(MDC.get("workerId"));
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
