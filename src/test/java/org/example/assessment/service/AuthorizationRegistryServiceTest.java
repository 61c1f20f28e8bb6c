package org.example.assessment.service;

import org.example.assessment.entity.AuthorizedCallerEntity;
import org.example.assessment.repository.AuthorizedCallerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorizationRegistryServiceTest {

    private static final String OWNER = "0xowner";

    @Mock
    private AuthorizedCallerRepository callerRepository;

    @Mock
    private LedgerSettingsService settingsService;

    @Mock
    private AuditEventService auditEventService;

    private AuthorizationRegistryService registry;

    @BeforeEach
    void setUp() {
        registry = new AuthorizationRegistryService(
                callerRepository,
                settingsService,
                auditEventService,
                new LedgerSequencer(TransactionOperations.withoutTransaction()));
    }

    @Test
    void addCaller_newCaller_isStoredAndRecorded() {
        when(callerRepository.existsById("assessment-manager")).thenReturn(false);

        boolean added = registry.addCaller(OWNER, "Assessment-Manager");

        assertTrue(added);
        verify(callerRepository).save(any(AuthorizedCallerEntity.class));
        verify(auditEventService).record("CallerAdded", OWNER,
                Map.of("caller", "assessment-manager", "changed", true));
    }

    @Test
    void addCaller_alreadyPresent_isIdempotentButStillRecorded() {
        when(callerRepository.existsById("assessment-manager")).thenReturn(true);

        boolean added = registry.addCaller(OWNER, "assessment-manager");

        assertFalse(added);
        verify(callerRepository, never()).save(any());
        verify(auditEventService).record("CallerAdded", OWNER,
                Map.of("caller", "assessment-manager", "changed", false));
    }

    @Test
    void removeCaller_absentCaller_isIdempotentButStillRecorded() {
        when(callerRepository.existsById("0xabc")).thenReturn(false);

        boolean removed = registry.removeCaller(OWNER, "0xabc");

        assertFalse(removed);
        verify(callerRepository, never()).deleteById(anyString());
        verify(auditEventService).record(eq("CallerRemoved"), eq(OWNER), anyMap());
    }

    @Test
    void removeCaller_presentCaller_isDeleted() {
        when(callerRepository.existsById("0xabc")).thenReturn(true);

        assertTrue(registry.removeCaller(OWNER, "0xabc"));

        verify(callerRepository).deleteById("0xabc");
    }

    @Test
    void mutations_byNonOwner_failWithNotOwner() {
        doThrow(new AssessmentException(AssessmentError.NOT_OWNER))
                .when(settingsService).requireOwner("0xmallory");

        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> registry.addCaller("0xmallory", "0xmallory"));

        assertEquals(AssessmentError.NOT_OWNER, ex.getError());
        verifyNoInteractions(callerRepository, auditEventService);
    }

    @Test
    void isAuthorized_blankIdentity_isFalseWithoutLookup() {
        assertFalse(registry.isAuthorized("  "));
        assertFalse(registry.isAuthorized(null));

        verifyNoInteractions(callerRepository);
    }

    @Test
    void listCallers_returnsIdsInAuthorizationOrder() {
        when(callerRepository.findAllByOrderByAuthorizedAtAsc()).thenReturn(List.of(
                new AuthorizedCallerEntity("assessment-manager", OWNER),
                new AuthorizedCallerEntity("0xabc", OWNER)));

        assertEquals(List.of("assessment-manager", "0xabc"), registry.listCallers());
    }
}
