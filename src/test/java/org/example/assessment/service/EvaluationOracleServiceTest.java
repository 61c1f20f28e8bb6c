package org.example.assessment.service;

import org.example.assessment.entity.OracleConfigEntity;
import org.example.assessment.entity.OracleRequestEntity;
import org.example.assessment.model.EvaluationResult;
import org.example.assessment.repository.OracleConfigRepository;
import org.example.assessment.repository.OracleRequestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvaluationOracleServiceTest {

    private static final String OWNER = "0xowner";
    private static final String MANAGER = "assessment-manager";
    private static final String USER = "0xa11ce";
    private static final String REQUEST_ID = "0x" + "1f".repeat(32);
    private static final String ANSWERS_HASH = "0x" + "aa".repeat(32);
    private static final String CONTENT_HASH = "0x" + "cc".repeat(32);
    private static final String RESULT_HASH = "0x" + "de".repeat(32);

    @Mock
    private OracleRequestRepository requestRepository;

    @Mock
    private OracleConfigRepository configRepository;

    @Mock
    private AuthorizationRegistryService authorizationRegistry;

    @Mock
    private LedgerSettingsService settingsService;

    @Mock
    private EvaluationNetwork evaluationNetwork;

    @Mock
    private AssessmentService assessmentService;

    @Mock
    private AuditEventService auditEventService;

    private EvaluationOracleService oracleService;

    @BeforeEach
    void setUp() {
        oracleService = new EvaluationOracleService(
                requestRepository,
                configRepository,
                authorizationRegistry,
                settingsService,
                evaluationNetwork,
                new EvaluationResultDecoder(),
                assessmentService,
                auditEventService,
                new LedgerSequencer(TransactionOperations.withoutTransaction()));
    }

    @Test
    void requestEvaluation_unauthorizedCaller_failsBeforeSending() {
        when(authorizationRegistry.isAuthorized("0xintruder")).thenReturn(false);

        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> oracleService.requestEvaluation("0xintruder", USER, "univ2", ANSWERS_HASH, CONTENT_HASH));

        assertEquals(AssessmentError.CALLER_NOT_AUTHORIZED, ex.getError());
        verifyNoInteractions(evaluationNetwork, requestRepository);
    }

    @Test
    void requestEvaluation_noSource_failsWithSourceNotConfigured() {
        when(authorizationRegistry.isAuthorized(MANAGER)).thenReturn(true);
        when(configRepository.findById(OracleConfigEntity.GLOBAL_ID)).thenReturn(Optional.empty());

        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> oracleService.requestEvaluation(MANAGER, USER, "univ2", ANSWERS_HASH, CONTENT_HASH));

        assertEquals(AssessmentError.SOURCE_NOT_CONFIGURED, ex.getError());
        verifyNoInteractions(evaluationNetwork);
    }

    @Test
    void requestEvaluation_zeroSubscription_failsWithSubscriptionNotConfigured() {
        when(authorizationRegistry.isAuthorized(MANAGER)).thenReturn(true);
        when(configRepository.findById(OracleConfigEntity.GLOBAL_ID)).thenReturn(Optional.of(config(0, "grade it")));

        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> oracleService.requestEvaluation(MANAGER, USER, "univ2", ANSWERS_HASH, CONTENT_HASH));

        assertEquals(AssessmentError.SUBSCRIPTION_NOT_CONFIGURED, ex.getError());
        verifyNoInteractions(evaluationNetwork);
    }

    @Test
    void requestEvaluation_configured_sendsArgumentsAndRecordsOutstandingRequest() {
        when(authorizationRegistry.isAuthorized(MANAGER)).thenReturn(true);
        when(configRepository.findById(OracleConfigEntity.GLOBAL_ID)).thenReturn(Optional.of(config(7, "grade it")));
        when(evaluationNetwork.sendRequest(any())).thenReturn(REQUEST_ID);
        when(evaluationNetwork.getNetworkName()).thenReturn("stub");
        when(requestRepository.existsById(REQUEST_ID)).thenReturn(false);

        String requestId = oracleService.requestEvaluation(MANAGER, USER, "univ2", ANSWERS_HASH, CONTENT_HASH);

        assertEquals(REQUEST_ID, requestId);
        ArgumentCaptor<EvaluationRequest> sent = ArgumentCaptor.forClass(EvaluationRequest.class);
        verify(evaluationNetwork).sendRequest(sent.capture());
        assertEquals(7L, sent.getValue().subscriptionId());
        assertEquals("grade it", sent.getValue().sourceCode());
        assertEquals(List.of("univ2", ANSWERS_HASH, CONTENT_HASH), sent.getValue().args());

        ArgumentCaptor<OracleRequestEntity> saved = ArgumentCaptor.forClass(OracleRequestEntity.class);
        verify(requestRepository).save(saved.capture());
        assertEquals(USER, saved.getValue().getUserId());
        assertEquals("univ2", saved.getValue().getQuestionSetId());
        verify(auditEventService).record(eq("EvaluationRequested"), eq(MANAGER), anyMap());
    }

    @Test
    void requestEvaluation_malformedIdFromNetwork_failsWithoutRecording() {
        when(authorizationRegistry.isAuthorized(MANAGER)).thenReturn(true);
        when(configRepository.findById(OracleConfigEntity.GLOBAL_ID)).thenReturn(Optional.of(config(7, "grade it")));
        when(evaluationNetwork.sendRequest(any())).thenReturn("not-an-id");

        assertThrows(IllegalStateException.class,
                () -> oracleService.requestEvaluation(MANAGER, USER, "univ2", ANSWERS_HASH, CONTENT_HASH));

        verify(requestRepository, never()).save(any());
    }

    @Test
    void onEvaluationCallback_knownRequest_consumesItAndCompletesAssessment() {
        OracleRequestEntity outstanding = new OracleRequestEntity(REQUEST_ID, USER, "univ2");
        when(requestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(outstanding));

        EvaluationResult result = oracleService.onEvaluationCallback(
                REQUEST_ID.toUpperCase().replace("0X", "0x"), bytes("85," + RESULT_HASH));

        assertEquals(new EvaluationResult(85, RESULT_HASH), result);
        verify(requestRepository).delete(outstanding);
        verify(assessmentService).onVerificationComplete(USER, 85, RESULT_HASH, REQUEST_ID);
    }

    @Test
    void onEvaluationCallback_malformedPayload_completesWithZeroResult() {
        OracleRequestEntity outstanding = new OracleRequestEntity(REQUEST_ID, USER, "univ2");
        when(requestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(outstanding));

        EvaluationResult result = oracleService.onEvaluationCallback(REQUEST_ID, bytes("eighty five"));

        assertEquals(new EvaluationResult(0, Hashes.ZERO), result);
        verify(requestRepository).delete(outstanding);
        verify(assessmentService).onVerificationComplete(USER, 0, Hashes.ZERO, REQUEST_ID);
    }

    @Test
    void onEvaluationCallback_unknownRequest_isRejectedAndAudited() {
        when(requestRepository.findById(REQUEST_ID)).thenReturn(Optional.empty());

        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> oracleService.onEvaluationCallback(REQUEST_ID, bytes("85," + RESULT_HASH)));

        assertEquals(AssessmentError.UNKNOWN_REQUEST, ex.getError());
        verify(auditEventService).record(eq("CallbackRejected"), isNull(), anyMap());
        verify(assessmentService, never()).onVerificationComplete(anyString(), anyInt(), anyString(), any());
    }

    @Test
    void onEvaluationCallback_garbageRequestId_isRejectedWithoutLookup() {
        assertThrows(AssessmentException.class,
                () -> oracleService.onEvaluationCallback("nope", bytes("85," + RESULT_HASH)));

        verify(requestRepository, never()).findById(anyString());
    }

    @Test
    void onEvaluationFulfilled_rejectedCallback_doesNotPropagate() {
        when(requestRepository.findById(REQUEST_ID)).thenReturn(Optional.empty());

        assertDoesNotThrow(() -> oracleService.onEvaluationFulfilled(
                new EvaluationFulfilledEvent(REQUEST_ID, bytes("85," + RESULT_HASH))));
    }

    @Test
    void submitManualResult_cancelsOutstandingRequestAndCompletesWithClampedScore() {
        OracleRequestEntity outstanding = new OracleRequestEntity(REQUEST_ID, USER, "univ2");
        when(requestRepository.findByUserId(USER)).thenReturn(List.of(outstanding));

        EvaluationResult result = oracleService.submitManualResult(OWNER, USER, RESULT_HASH, 150);

        assertEquals(100, result.score());
        verify(requestRepository).delete(outstanding);
        verify(auditEventService).record(eq("VerificationCancelled"), isNull(), anyMap());
        verify(auditEventService).record(eq("ManualResultSubmitted"), eq(OWNER), anyMap());
        verify(assessmentService).onVerificationComplete(USER, 100, RESULT_HASH, null);
    }

    @Test
    void submitManualResult_nonOwner_failsWithNotOwner() {
        doThrow(new AssessmentException(AssessmentError.NOT_OWNER)).when(settingsService).requireOwner(USER);

        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> oracleService.submitManualResult(USER, USER, RESULT_HASH, 90));

        assertEquals(AssessmentError.NOT_OWNER, ex.getError());
        verifyNoInteractions(assessmentService);
    }

    @Test
    void submitManualResult_malformedHash_failsWithInvalidResultHash() {
        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> oracleService.submitManualResult(OWNER, USER, "0x1234", 90));

        assertEquals(AssessmentError.INVALID_RESULT_HASH, ex.getError());
    }

    @Test
    void updateConfig_negativeSubscription_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> oracleService.updateConfig(OWNER, -1, new byte[0], "don"));

        verify(configRepository, never()).save(any());
    }

    @Test
    void testEvaluation_decodesWithoutSideEffects() {
        EvaluationResult result = oracleService.testEvaluation("42," + RESULT_HASH);

        assertEquals(42, result.score());
        verifyNoInteractions(requestRepository, assessmentService, auditEventService);
    }

    private static OracleConfigEntity config(long subscriptionId, String source) {
        OracleConfigEntity config = new OracleConfigEntity();
        config.setSubscriptionId(subscriptionId);
        config.setEncryptedSecrets(new byte[0]);
        config.setDonId("local");
        config.setEvaluationSource(source);
        return config;
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
