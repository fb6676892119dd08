package com.ecp.governance.controller;

import com.ecp.governance.exception.IngressRejectedException;
import com.ecp.governance.exception.ReplayRejectedException;
import com.ecp.governance.model.CausationType;
import com.ecp.governance.model.DecisionEvent;
import com.ecp.governance.service.EventGateService;
import com.ecp.governance.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DecisionController.class)
class DecisionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private EventGateService eventGateService;

    @Test
    void enforceDecision_accepted() throws Exception {
        when(eventGateService.enforceDecision(any())).thenReturn("evt_3f9a0c1d22b4e8a1");

        mockMvc.perform(post("/api/v1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                TestDataFactory.createDecisionRequest("publish_report", TestDataFactory.createContext()))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventId").value("evt_3f9a0c1d22b4e8a1"));
    }

    @Test
    void enforceDecision_missingContext_returns400WithFields() throws Exception {
        when(eventGateService.enforceDecision(any()))
                .thenThrow(new IngressRejectedException(List.of("causation", "dutyOfCare")));

        mockMvc.perform(post("/api/v1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actionType\":\"publish_report\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ingress_rejected"))
                .andExpect(jsonPath("$.missingFields[0]").value("causation"))
                .andExpect(jsonPath("$.missingFields[1]").value("dutyOfCare"));
    }

    @Test
    void enforceDecision_replay_returns409() throws Exception {
        when(eventGateService.enforceDecision(any())).thenThrow(new ReplayRejectedException("evt_dup"));

        mockMvc.perform(post("/api/v1/decisions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                TestDataFactory.createDecisionRequest("publish_report", TestDataFactory.createContext()))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("replay_rejected"))
                .andExpect(jsonPath("$.eventId").value("evt_dup"));
    }

    @Test
    void getDecision_found() throws Exception {
        DecisionEvent event = DecisionEvent.builder()
                .eventId("evt_1")
                .eventType("decision_publish_report")
                .actionType("publish_report")
                .causation(CausationType.AI_DECISION)
                .agencyPresent(true)
                .ledgerSequence(4)
                .build();
        when(eventGateService.getEvent("evt_1")).thenReturn(Optional.of(event));

        mockMvc.perform(get("/api/v1/decisions/evt_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eventId").value("evt_1"))
                .andExpect(jsonPath("$.causation").value("ai_decision"))
                .andExpect(jsonPath("$.ledgerSequence").value(4));
    }

    @Test
    void getDecision_notFound() throws Exception {
        when(eventGateService.getEvent("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/decisions/missing"))
                .andExpect(status().isNotFound());
    }
}
