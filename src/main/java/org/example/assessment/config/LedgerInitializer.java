package org.example.assessment.config;

import org.example.assessment.service.AuthorizationRegistryService;
import org.example.assessment.service.LedgerSettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * First-start setup: writes the settings row and authorizes the bootstrap callers.
 */
@Component
@Order(1)
public class LedgerInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(LedgerInitializer.class);

    private final LedgerSettingsService settingsService;
    private final AuthorizationRegistryService authorizationRegistry;
    private final String bootstrapCallers;

    public LedgerInitializer(
            LedgerSettingsService settingsService,
            AuthorizationRegistryService authorizationRegistry,
            @Value("${oracle.bootstrap-authorized-callers:${assessment.manager-identity:assessment-manager}}")
            String bootstrapCallers) {
        this.settingsService = settingsService;
        this.authorizationRegistry = authorizationRegistry;
        this.bootstrapCallers = bootstrapCallers;
    }

    @Override
    public void run(String... args) {
        if (!settingsService.ensureInitialized()) {
            log.info("Ledger already initialized, owner={}", settingsService.getOwner());
            return;
        }

        String owner = settingsService.getOwner();
        List<String> callers = Arrays.stream(bootstrapCallers.split(","))
                .map(String::trim)
                .filter(caller -> !caller.isEmpty())
                .toList();
        for (String caller : callers) {
            authorizationRegistry.addCaller(owner, caller);
        }
        log.info("Ledger initialized with {} bootstrap caller(s)", callers.size());
    }
}
