package org.example.assessment.controller;

import org.example.assessment.config.CallerIdentity;
import org.example.assessment.model.AssessmentStatusResponse;
import org.example.assessment.model.AssessmentView;
import org.example.assessment.service.AssessmentService;
import org.example.assessment.service.Identities;
import org.example.assessment.service.LedgerSettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Assessment lifecycle for the calling user. Start and answer submission act on the caller's own
 * assessment; submit and restart may also be invoked by the owner on behalf of a user.
 */
@RestController
@RequestMapping("/api/assessments")
public class AssessmentController {

    private final AssessmentService assessmentService;
    private final LedgerSettingsService settingsService;

    public AssessmentController(AssessmentService assessmentService, LedgerSettingsService settingsService) {
        this.assessmentService = assessmentService;
        this.settingsService = settingsService;
    }

    @PostMapping("/start")
    public AssessmentView start(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody StartRequest request) {
        return assessmentService.start(caller, request.questionSetId());
    }

    @PostMapping("/answers")
    public AssessmentView submitAnswers(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody AnswersRequest request) {
        return assessmentService.submitAnswers(caller, request.answersHash());
    }

    @PostMapping("/submit")
    public AssessmentView submitAssessment(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody(required = false) SubmitRequest request) {
        String user = request != null && request.user() != null && !request.user().isBlank()
                ? request.user()
                : caller;
        String answersHash = request != null ? request.answersHash() : null;
        return assessmentService.submitAssessment(caller, user, answersHash);
    }

    @PostMapping("/{user}/restart")
    public AssessmentView restart(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @PathVariable String user) {
        return assessmentService.restart(caller, user);
    }

    /**
     * The outstanding request id is shown only to the user and the owner.
     */
    @GetMapping("/{user}")
    public ResponseEntity<AssessmentView> get(
            @RequestAttribute(value = CallerIdentity.ATTRIBUTE_NAME, required = false) String caller,
            @PathVariable String user) {
        boolean privileged = caller != null
                && (caller.equals(Identities.normalize(user)) || settingsService.isOwner(caller));
        return assessmentService.getAssessment(user)
                .map(view -> privileged ? view : view.withoutPendingRequestId())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{user}/status")
    public AssessmentStatusResponse status(@PathVariable String user) {
        return assessmentService.getAssessmentStatus(user);
    }

    @GetMapping("/oracle-verification")
    public Map<String, Boolean> oracleVerification() {
        return Map.of("enabled", assessmentService.isOracleVerificationEnabled());
    }

    @PutMapping("/oracle-verification")
    public Map<String, Boolean> setOracleVerification(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody ToggleRequest request) {
        return Map.of("enabled", assessmentService.setOracleVerificationEnabled(caller, request.enabled()));
    }

    public record StartRequest(String questionSetId) {
    }

    public record AnswersRequest(String answersHash) {
    }

    public record SubmitRequest(String user, String answersHash) {
    }

    public record ToggleRequest(boolean enabled) {
    }
}
