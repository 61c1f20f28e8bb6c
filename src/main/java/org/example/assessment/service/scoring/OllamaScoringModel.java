package org.example.assessment.service.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Scoring model backed by a local Ollama server.
 * Calls /api/generate in JSON mode so the reply is a single JSON object.
 */
public class OllamaScoringModel implements ScoringModel {

    private static final Logger log = LoggerFactory.getLogger(OllamaScoringModel.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaScoringModel(String baseUrl, String model, int timeoutSeconds) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .build();
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        log.info("Ollama scoring model initialized: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    public String evaluate(String prompt, ScoringOptions options) {
        Map<String, Object> ollamaOptions = new HashMap<>();
        ollamaOptions.put("temperature", options.temperature());
        if (options.maxTokens() != null) {
            ollamaOptions.put("num_predict", options.maxTokens());
        }

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "format", "json",
                "options", ollamaOptions
        );

        try {
            String response = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            JsonNode responseNode = objectMapper.readTree(response);
            JsonNode text = responseNode.get("response");
            if (text == null) {
                throw new ScoringModelException("Ollama response has no 'response' field");
            }
            return text.asText();

        } catch (WebClientResponseException e) {
            log.error("Ollama API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ScoringModelException("Ollama API error: " + e.getStatusCode(), e);
        } catch (ScoringModelException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to get score from Ollama", e);
            throw new ScoringModelException("Failed to get score from Ollama", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(2));
            return true;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getModelName() {
        return "ollama";
    }
}
