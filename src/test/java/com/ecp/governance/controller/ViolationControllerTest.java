package com.ecp.governance.controller;

import com.ecp.governance.model.Severity;
import com.ecp.governance.model.Violation;
import com.ecp.governance.model.ViolationReport;
import com.ecp.governance.service.ViolationTrackerService;
import com.ecp.governance.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ViolationController.class)
class ViolationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ViolationTrackerService violationTracker;

    @Test
    void recordViolation_success() throws Exception {
        when(violationTracker.recordViolation(eq("policy_breach"), eq(Severity.WARNING), eq("over limit"),
                eq("agent-1"), isNull(), isNull(), anyMap())).thenReturn("vio_20250218_134244_123_5f1c2a9e");

        mockMvc.perform(post("/api/v1/violations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"violationType":"policy_breach","severity":"warning",
                                 "message":"over limit","agentId":"agent-1","context":{"limit":10}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.violationId").value("vio_20250218_134244_123_5f1c2a9e"));
    }

    @Test
    void recordViolation_missingSeverity_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/violations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"violationType\":\"policy_breach\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("severity is required"));
        verifyNoInteractions(violationTracker);
    }

    @Test
    void recordViolation_nonStringMessage_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/violations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"violationType\":\"policy_breach\",\"severity\":\"audit\",\"message\":{\"text\":\"x\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("message must be a string"));
        verifyNoInteractions(violationTracker);
    }

    @Test
    void getViolations_combinesFilters() throws Exception {
        long now = System.currentTimeMillis();
        Violation match = TestDataFactory.createViolation("vio_1", "missing_context", Severity.AUDIT, "agent-1", now);
        Violation otherSeverity = TestDataFactory.createViolation("vio_2", "replay_attempt", Severity.WARNING,
                "agent-1", now);
        when(violationTracker.getViolationsByAgent("agent-1")).thenReturn(List.of(match, otherSeverity));

        mockMvc.perform(get("/api/v1/violations?agentId=agent-1&severity=audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].violationId").value("vio_1"))
                .andExpect(jsonPath("$[0].severity").value("audit"));
    }

    @Test
    void getViolation_notFound() throws Exception {
        when(violationTracker.getViolation("vio_missing")).thenReturn(null);

        mockMvc.perform(get("/api/v1/violations/vio_missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getReport_success() throws Exception {
        when(violationTracker.generateReport()).thenReturn(ViolationReport.builder()
                .totalViolations(3)
                .blockingViolations(1)
                .violationsByType(Map.of("unclassified_event", 1))
                .violationsByAgent(Map.of())
                .build());

        mockMvc.perform(get("/api/v1/violations/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalViolations").value(3))
                .andExpect(jsonPath("$.violationsByType.unclassified_event").value(1));
    }
}
