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
import java.util.List;
import java.util.Map;

/**
 * Scoring model backed by xAI (Grok) through the OpenAI-compatible chat completions endpoint,
 * with JSON object responses requested.
 */
public class XaiScoringModel implements ScoringModel {

    private static final Logger log = LoggerFactory.getLogger(XaiScoringModel.class);
    private static final String BASE_URL = "https://api.x.ai/v1";
    private static final String SYSTEM_PROMPT =
            "You grade answers. Reply with one JSON object and nothing else.";

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public XaiScoringModel(String apiKey, String model, int timeoutSeconds) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build();
        log.info("xAI scoring model initialized: model={}", model);
    }

    @Override
    public String evaluate(String prompt, ScoringOptions options) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        requestBody.put("temperature", options.temperature());
        requestBody.put("response_format", Map.of("type", "json_object"));
        if (options.maxTokens() != null) {
            requestBody.put("max_tokens", options.maxTokens());
        }

        try {
            String response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            JsonNode responseNode = objectMapper.readTree(response);
            JsonNode choices = responseNode.get("choices");
            if (choices != null && choices.isArray() && choices.size() > 0) {
                JsonNode message = choices.get(0).get("message");
                if (message != null && message.has("content")) {
                    return message.get("content").asText();
                }
            }

            throw new ScoringModelException("Invalid response format from xAI API");

        } catch (WebClientResponseException e) {
            log.error("xAI API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ScoringModelException("xAI API error: " + e.getStatusCode(), e);
        } catch (ScoringModelException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to get score from xAI", e);
            throw new ScoringModelException("Failed to get score from xAI", e);
        }
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("xAI not available: API key not configured");
            return false;
        }
        // A configured key is treated as available without a network round trip.
        return true;
    }

    @Override
    public String getModelName() {
        return "xai";
    }
}
