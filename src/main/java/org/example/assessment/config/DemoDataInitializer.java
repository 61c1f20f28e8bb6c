package org.example.assessment.config;

import org.example.assessment.service.EvaluationOracleService;
import org.example.assessment.service.LedgerSettingsService;
import org.example.assessment.service.QuestionCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Seeds a demo question set and a local scoring configuration for development.
 */
@Component
@Profile("dev")
@Order(2) // After LedgerInitializer
public class DemoDataInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoDataInitializer.class);

    static final String DEMO_SET_ID = "univ2";
    static final String DEMO_CONTENT_HASH = "0x" + "c0".repeat(32);
    static final int DEMO_QUESTION_COUNT = 5;
    static final long DEMO_SUBSCRIPTION_ID = 1L;
    static final String DEMO_SOURCE = """
            You are grading a short free-text quiz about Uniswap v2 (question set {questionSetId}).
            The questions are stored under {contentHash} and the learner's answers under {answersHash}.
            Score the answers from 0 to 100 for accuracy and completeness.
            """;

    private final QuestionCatalogService catalogService;
    private final EvaluationOracleService oracleService;
    private final LedgerSettingsService settingsService;

    public DemoDataInitializer(
            QuestionCatalogService catalogService,
            EvaluationOracleService oracleService,
            LedgerSettingsService settingsService) {
        this.catalogService = catalogService;
        this.oracleService = oracleService;
        this.settingsService = settingsService;
    }

    @Override
    public void run(String... args) {
        if (catalogService.questionSetCount() > 0) {
            log.info("Catalog already contains question sets, skipping demo seed");
            return;
        }

        String owner = settingsService.getOwner();
        catalogService.submitQuestionSet(owner, DEMO_SET_ID, DEMO_CONTENT_HASH, DEMO_QUESTION_COUNT);
        oracleService.updateConfig(owner, DEMO_SUBSCRIPTION_ID, new byte[0], "local");
        oracleService.updateEvaluationSource(owner, DEMO_SOURCE);
        log.info("Seeded demo question set {} and local scoring configuration", DEMO_SET_ID);
    }
}
