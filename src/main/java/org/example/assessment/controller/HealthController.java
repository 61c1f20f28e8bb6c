package org.example.assessment.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.assessment.config.RequestCorrelation;
import org.example.assessment.entity.AssessmentStatus;
import org.example.assessment.model.AuditChainStatus;
import org.example.assessment.service.AssessmentService;
import org.example.assessment.service.AuditEventService;
import org.example.assessment.service.EvaluationNetwork;
import org.example.assessment.service.EvaluationOracleService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class HealthController {

    private final EvaluationNetwork evaluationNetwork;
    private final EvaluationOracleService oracleService;
    private final AssessmentService assessmentService;
    private final AuditEventService auditEventService;

    public HealthController(
            EvaluationNetwork evaluationNetwork,
            EvaluationOracleService oracleService,
            AssessmentService assessmentService,
            AuditEventService auditEventService) {
        this.evaluationNetwork = evaluationNetwork;
        this.oracleService = oracleService;
        this.assessmentService = assessmentService;
        this.auditEventService = auditEventService;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        NetworkHealth network = new NetworkHealth(
                evaluationNetwork.getNetworkName(),
                evaluationNetwork.isAvailable(),
                evaluationNetwork.isWorkerRunning(),
                evaluationNetwork.getQueueDepth(),
                oracleService.outstandingRequestCount()
        );
        AssessmentCounts assessments = new AssessmentCounts(
                assessmentService.countByStatus(AssessmentStatus.STARTED),
                assessmentService.countByStatus(AssessmentStatus.ANSWERS_SUBMITTED),
                assessmentService.countByStatus(AssessmentStatus.VERIFYING),
                assessmentService.countByStatus(AssessmentStatus.COMPLETED)
        );
        AuditChainStatus auditChain = auditEventService.verifyChain();

        boolean healthy = network.workerRunning() && auditChain.valid();
        return new HealthDetails(
                healthy ? "ok" : "degraded",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                assessmentService.isOracleVerificationEnabled(),
                network,
                assessments,
                auditChain
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            String requestId,
            LocalDateTime asOf,
            boolean oracleVerificationEnabled,
            NetworkHealth network,
            AssessmentCounts assessments,
            AuditChainStatus auditChain
    ) {
    }

    public record NetworkHealth(
            String name,
            boolean available,
            boolean workerRunning,
            int queueDepth,
            long outstandingRequests
    ) {
    }

    public record AssessmentCounts(
            long started,
            long answersSubmitted,
            long verifying,
            long completed
    ) {
    }
}
