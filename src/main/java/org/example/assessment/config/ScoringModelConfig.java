package org.example.assessment.config;

import org.example.assessment.service.scoring.OllamaScoringModel;
import org.example.assessment.service.scoring.ScoringModel;
import org.example.assessment.service.scoring.XaiScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the language model used by the built-in evaluation network.
 */
@Configuration
public class ScoringModelConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringModelConfig.class);

    @Value("${scoring.provider:ollama}")
    private String provider;

    @Value("${scoring.timeout-seconds:120}")
    private int timeoutSeconds;

    @Value("${scoring.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${scoring.ollama.model:llama3.1:latest}")
    private String ollamaModel;

    @Value("${scoring.xai.api-key:}")
    private String xaiApiKey;

    @Value("${scoring.xai.model:grok-4-1-fast-reasoning}")
    private String xaiModel;

    @Bean
    @Qualifier("evaluationScoringModel")
    public ScoringModel evaluationScoringModel() {
        log.info("Configuring evaluation scoring model: {}", provider);
        return switch (provider.toLowerCase()) {
            case "ollama" -> new OllamaScoringModel(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            case "xai" -> {
                if (xaiApiKey == null || xaiApiKey.isBlank()) {
                    log.warn("xAI API key not configured for scoring, falling back to Ollama");
                    yield new OllamaScoringModel(ollamaBaseUrl, ollamaModel, timeoutSeconds);
                }
                yield new XaiScoringModel(xaiApiKey, xaiModel, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown scoring provider '{}', falling back to Ollama", provider);
                yield new OllamaScoringModel(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
        };
    }
}
