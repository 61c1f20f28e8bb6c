package org.example.assessment.controller;

import org.example.assessment.entity.AssessmentStatus;
import org.example.assessment.model.AuditChainStatus;
import org.example.assessment.service.AssessmentService;
import org.example.assessment.service.AuditEventService;
import org.example.assessment.service.EvaluationNetwork;
import org.example.assessment.service.EvaluationOracleService;
import org.example.assessment.service.LedgerSettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EvaluationNetwork evaluationNetwork;

    @MockitoBean
    private EvaluationOracleService oracleService;

    @MockitoBean
    private AssessmentService assessmentService;

    @MockitoBean
    private AuditEventService auditEventService;

    @MockitoBean
    private LedgerSettingsService settingsService;

    @Test
    void health_returnsBasicStatus() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")));
    }

    @Test
    void healthDetails_whenWorkerRunningAndChainIntact_returnsOkSnapshot() throws Exception {
        stubNetwork(true);
        when(oracleService.outstandingRequestCount()).thenReturn(2L);
        when(assessmentService.countByStatus(AssessmentStatus.VERIFYING)).thenReturn(2L);
        when(assessmentService.countByStatus(AssessmentStatus.COMPLETED)).thenReturn(7L);
        when(assessmentService.isOracleVerificationEnabled()).thenReturn(true);
        when(auditEventService.verifyChain()).thenReturn(new AuditChainStatus(true, 40, null));

        mockMvc.perform(get("/health/details"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.oracleVerificationEnabled", is(true)))
                .andExpect(jsonPath("$.network.name", is("llm:ollama")))
                .andExpect(jsonPath("$.network.queueDepth", is(1)))
                .andExpect(jsonPath("$.network.outstandingRequests", is(2)))
                .andExpect(jsonPath("$.assessments.verifying", is(2)))
                .andExpect(jsonPath("$.assessments.completed", is(7)))
                .andExpect(jsonPath("$.auditChain.eventCount", is(40)));
    }

    @Test
    void healthDetails_whenAuditChainBroken_returnsDegraded() throws Exception {
        stubNetwork(true);
        when(auditEventService.verifyChain()).thenReturn(new AuditChainStatus(false, 40, 12L));

        mockMvc.perform(get("/health/details"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("degraded")))
                .andExpect(jsonPath("$.auditChain.firstBrokenSequence", is(12)));
    }

    @Test
    void healthDetails_whenWorkerStopped_returnsDegraded() throws Exception {
        stubNetwork(false);
        when(auditEventService.verifyChain()).thenReturn(new AuditChainStatus(true, 0, null));

        mockMvc.perform(get("/health/details"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("degraded")))
                .andExpect(jsonPath("$.network.workerRunning", is(false)));
    }

    private void stubNetwork(boolean workerRunning) {
        when(evaluationNetwork.getNetworkName()).thenReturn("llm:ollama");
        when(evaluationNetwork.isAvailable()).thenReturn(true);
        when(evaluationNetwork.isWorkerRunning()).thenReturn(workerRunning);
        when(evaluationNetwork.getQueueDepth()).thenReturn(1);
    }
}
