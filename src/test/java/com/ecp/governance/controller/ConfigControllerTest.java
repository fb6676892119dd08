package com.ecp.governance.controller;

import com.ecp.governance.config.AerospikeConfig;
import com.ecp.governance.config.ConsensusConfig;
import com.ecp.governance.config.GovernanceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConsensusConfig consensusConfig;

    @MockBean
    private GovernanceConfig governanceConfig;

    @MockBean
    private AerospikeConfig aerospikeConfig;

    private ConsensusConfig.Weights weights;

    @BeforeEach
    void setUp() {
        weights = new ConsensusConfig.Weights();
        when(consensusConfig.getWeights()).thenReturn(weights);
        when(consensusConfig.getStatusScale()).thenReturn(new ConsensusConfig.StatusScale());
        when(consensusConfig.getRiskScale()).thenReturn(new ConsensusConfig.RiskScale());
        when(consensusConfig.getAggregation()).thenReturn(ConsensusConfig.Aggregation.MAX);
        when(consensusConfig.getReviewThreshold()).thenReturn(0.3);
    }

    // ── Consensus ──

    @Test
    void getConsensusConfig_success() throws Exception {
        mockMvc.perform(get("/api/v1/config/consensus"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.aggregation").value("MAX"))
                .andExpect(jsonPath("$.reviewThreshold").value(0.3))
                .andExpect(jsonPath("$.statusWeight").value(0.5))
                .andExpect(jsonPath("$.statusScale.questionable").value(0.5))
                .andExpect(jsonPath("$.riskScale.high").value(1.0));
    }

    @Test
    void updateConsensusConfig_success() throws Exception {
        mockMvc.perform(put("/api/v1/config/consensus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"aggregation\":\"mean\",\"reviewThreshold\":0.4,\"riskWeight\":0.5}"))
                .andExpect(status().isOk());

        verify(consensusConfig).setAggregation(ConsensusConfig.Aggregation.MEAN);
        verify(consensusConfig).setReviewThreshold(0.4);
        assertThat(weights.getRisk()).isEqualTo(0.5);
        assertThat(weights.getStatus()).isEqualTo(0.5);
    }

    @Test
    void updateConsensusConfig_negativeWeight_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/consensus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confidenceWeight\":-0.1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("confidenceWeight"));

        verify(consensusConfig, never()).setReviewThreshold(anyDouble());
        assertThat(weights.getConfidence()).isEqualTo(0.25);
    }

    @Test
    void updateConsensusConfig_allWeightsZero_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/consensus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"statusWeight\":0,\"confidenceWeight\":0,\"riskWeight\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("at least one weight must be > 0"));
    }

    @Test
    void updateConsensusConfig_unknownAggregation_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/consensus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"aggregation\":\"median\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("aggregation"));

        verify(consensusConfig, never()).setAggregation(any());
    }

    // ── Aerospike ──

    @Test
    void getAerospikeInfo_success() throws Exception {
        when(aerospikeConfig.getHost()).thenReturn("127.0.0.1");
        when(aerospikeConfig.getPort()).thenReturn(3000);
        when(aerospikeConfig.getNamespace()).thenReturn("ecp");

        mockMvc.perform(get("/api/v1/config/aerospike"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.namespace").value("ecp"))
                .andExpect(jsonPath("$.port").value(3000));
    }
}
