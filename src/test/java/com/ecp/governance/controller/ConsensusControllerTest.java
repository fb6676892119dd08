package com.ecp.governance.controller;

import com.ecp.governance.model.ConsensusRecord;
import com.ecp.governance.service.ConsensusScoringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConsensusController.class)
class ConsensusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConsensusScoringService consensusScoringService;

    private ConsensusRecord record() {
        return ConsensusRecord.builder()
                .eventId("evt_1")
                .classificationCount(2)
                .divergenceScore(0.325)
                .maxPairwiseDivergence(0.325)
                .aggregation("MAX")
                .threshold(0.3)
                .requiresHumanReview(true)
                .triggerReason(ConsensusRecord.REASON_DIVERGENCE)
                .pairwiseDivergences(List.of())
                .perClassifierBreakdown(List.of())
                .build();
    }

    @Test
    void score_success() throws Exception {
        when(consensusScoringService.scoreEvent("evt_1")).thenReturn(Optional.of(record()));

        mockMvc.perform(post("/api/v1/consensus/evt_1/score"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiresHumanReview").value(true))
                .andExpect(jsonPath("$.triggerReason").value("divergence_threshold"));
    }

    @Test
    void score_tooFewClassifications_returns204() throws Exception {
        when(consensusScoringService.scoreEvent("evt_1")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/consensus/evt_1/score"))
                .andExpect(status().isNoContent());
    }

    @Test
    void getConsensus_found() throws Exception {
        when(consensusScoringService.getConsensus("evt_1")).thenReturn(record());

        mockMvc.perform(get("/api/v1/consensus/evt_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxPairwiseDivergence").value(0.325));
    }

    @Test
    void getConsensus_notFound() throws Exception {
        when(consensusScoringService.getConsensus("missing")).thenReturn(null);

        mockMvc.perform(get("/api/v1/consensus/missing"))
                .andExpect(status().isNotFound());
    }
}
