package org.example.assessment.service;

import org.example.assessment.entity.AuthorizedCallerEntity;
import org.example.assessment.repository.AuthorizedCallerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Owner-controlled allow-list of identities permitted to request evaluations.
 */
@Service
public class AuthorizationRegistryService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationRegistryService.class);

    private final AuthorizedCallerRepository callerRepository;
    private final LedgerSettingsService settingsService;
    private final AuditEventService auditEventService;
    private final LedgerSequencer sequencer;

    public AuthorizationRegistryService(
            AuthorizedCallerRepository callerRepository,
            LedgerSettingsService settingsService,
            AuditEventService auditEventService,
            LedgerSequencer sequencer) {
        this.callerRepository = callerRepository;
        this.settingsService = settingsService;
        this.auditEventService = auditEventService;
        this.sequencer = sequencer;
    }

    /**
     * Adds a caller. Adding a present caller changes nothing but is still recorded.
     *
     * @return true if the caller was newly added
     */
    public boolean addCaller(String actor, String identity) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            String caller = Identities.require(identity);
            boolean added = !callerRepository.existsById(caller);
            if (added) {
                callerRepository.save(new AuthorizedCallerEntity(caller, Identities.normalize(actor)));
                log.info("Authorized caller {}", caller);
            } else {
                log.debug("Caller {} already authorized", caller);
            }
            auditEventService.record("CallerAdded", Identities.normalize(actor), AuditEventService.fields(
                    "caller", caller,
                    "changed", added));
            return added;
        });
    }

    /**
     * Removes a caller. Removing an absent caller changes nothing but is still recorded.
     *
     * @return true if the caller was present
     */
    public boolean removeCaller(String actor, String identity) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            String caller = Identities.require(identity);
            boolean removed = callerRepository.existsById(caller);
            if (removed) {
                callerRepository.deleteById(caller);
                log.info("Revoked caller {}", caller);
            } else {
                log.debug("Caller {} was not authorized", caller);
            }
            auditEventService.record("CallerRemoved", Identities.normalize(actor), AuditEventService.fields(
                    "caller", caller,
                    "changed", removed));
            return removed;
        });
    }

    @Transactional(readOnly = true)
    public boolean isAuthorized(String identity) {
        String caller = Identities.normalize(identity);
        return caller != null && callerRepository.existsById(caller);
    }

    @Transactional(readOnly = true)
    public List<String> listCallers() {
        return callerRepository.findAllByOrderByAuthorizedAtAsc().stream()
                .map(AuthorizedCallerEntity::getCallerId)
                .toList();
    }
}
