package com.ecp.governance.controller;

import com.ecp.governance.model.CheckResult;
import com.ecp.governance.model.ConsistencyError;
import com.ecp.governance.model.ConsistencyReport;
import com.ecp.governance.service.ConsistencyCheckService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConsistencyController.class)
class ConsistencyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConsistencyCheckService consistencyCheckService;

    @Test
    void runCheck_degraded() throws Exception {
        ConsistencyError error = new ConsistencyError("chain_integrity", "critical", "3", "hash mismatch");
        ConsistencyReport report = ConsistencyReport.builder()
                .checksRun(6)
                .checksFailed(1)
                .totalErrors(1)
                .status(ConsistencyReport.DEGRADED)
                .checks(Map.of("chain_integrity", new CheckResult("Hash chain integrity check", "critical", List.of(error))))
                .criticalErrors(List.of(error))
                .build();
        when(consistencyCheckService.runCheck()).thenReturn(report);

        mockMvc.perform(post("/api/v1/consistency/check"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.criticalErrors[0].referenceId").value("3"))
                .andExpect(jsonPath("$.checks.chain_integrity.severity").value("critical"));
    }

    @Test
    void getLastReport_beforeAnyRun_returns204() throws Exception {
        when(consistencyCheckService.getLastReport()).thenReturn(null);

        mockMvc.perform(get("/api/v1/consistency/last"))
                .andExpect(status().isNoContent());
    }
}
