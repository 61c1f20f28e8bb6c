package org.example.assessment.service.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.example.assessment.service.EvaluationFulfilledEvent;
import org.example.assessment.service.EvaluationNetwork;
import org.example.assessment.service.EvaluationRequest;
import org.example.assessment.service.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Built-in scoring network: requests are queued and graded one at a time by a language model on a
 * background worker. Each request is fulfilled exactly once with {@code "<score>,<sha256(feedback)>"},
 * or with a zero result when grading fails.
 */
@Component
public class LlmEvaluationNetwork implements EvaluationNetwork {

    private static final Logger log = LoggerFactory.getLogger(LlmEvaluationNetwork.class);

    static final String FAILED_RESULT = "0," + Hashes.ZERO;

    private static final String RESPONSE_INSTRUCTIONS = """

            Respond with a JSON object of the form {"score": <integer 0-100>, "feedback": "<short explanation>"}.
            """;

    private final ScoringModel scoringModel;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<PendingEvaluation> requestQueue = new LinkedBlockingQueue<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final AtomicLong requestCounter = new AtomicLong();
    private volatile boolean running = true;

    public LlmEvaluationNetwork(
            @Qualifier("evaluationScoringModel") ScoringModel scoringModel,
            ApplicationEventPublisher eventPublisher,
            ObjectMapper objectMapper) {
        this.scoringModel = scoringModel;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        executor.submit(this::processQueue);
        log.info("Evaluation network started with background worker (model={})", scoringModel.getModelName());
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        executor.shutdownNow();
        log.info("Evaluation network shutting down with {} request(s) unfulfilled", requestQueue.size());
    }

    @Override
    public String sendRequest(EvaluationRequest request) {
        String requestId = mintRequestId(request);
        requestQueue.offer(new PendingEvaluation(requestId, request));
        log.debug("Queued evaluation request {} (queue depth {})", requestId, requestQueue.size());
        return requestId;
    }

    @Override
    public boolean isAvailable() {
        return scoringModel.isAvailable();
    }

    @Override
    public String getNetworkName() {
        return "llm:" + scoringModel.getModelName();
    }

    @Override
    public int getQueueDepth() {
        return requestQueue.size();
    }

    @Override
    public boolean isWorkerRunning() {
        return !executor.isShutdown() && !executor.isTerminated();
    }

    /**
     * Fulfils the next queued request, waiting up to the given time for one to arrive.
     *
     * @return true if a request was fulfilled
     */
    boolean processNext(long timeout, TimeUnit unit) throws InterruptedException {
        PendingEvaluation pending = requestQueue.poll(timeout, unit);
        if (pending == null) {
            return false;
        }
        fulfil(pending);
        return true;
    }

    String evaluate(EvaluationRequest request) {
        try {
            if (!scoringModel.isAvailable()) {
                log.warn("Scoring model {} unavailable; fulfilling with zero result", scoringModel.getModelName());
                return FAILED_RESULT;
            }
            String response = scoringModel.evaluate(buildPrompt(request), ScoringOptions.deterministic());
            JsonNode verdict = objectMapper.readTree(extractJsonObject(response));
            JsonNode score = verdict.get("score");
            if (score == null || !score.canConvertToInt()) {
                throw new ScoringModelException("Scoring response has no integer score");
            }
            int clamped = Math.max(0, Math.min(100, score.asInt()));
            String feedback = verdict.path("feedback").asText("");
            return clamped + "," + Hashes.sha256(feedback);
        } catch (Exception e) {
            log.error("Scoring failed; fulfilling with zero result", e);
            return FAILED_RESULT;
        }
    }

    String buildPrompt(EvaluationRequest request) {
        List<String> args = request.args();
        String prompt = request.sourceCode()
                .replace("{questionSetId}", argument(args, 0))
                .replace("{answersHash}", argument(args, 1))
                .replace("{contentHash}", argument(args, 2));
        return prompt + "\n\nQuestion set: " + argument(args, 0)
                + "\nAnswers reference: " + argument(args, 1)
                + "\nQuestions reference: " + argument(args, 2)
                + RESPONSE_INSTRUCTIONS;
    }

    private void processQueue() {
        while (running) {
            try {
                PendingEvaluation pending = requestQueue.take();
                fulfil(pending);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error processing evaluation queue", e);
            }
        }
    }

    private void fulfil(PendingEvaluation pending) {
        String result = evaluate(pending.request());
        log.info("Fulfilling evaluation request {}", pending.requestId());
        eventPublisher.publishEvent(new EvaluationFulfilledEvent(
                pending.requestId(), result.getBytes(StandardCharsets.UTF_8)));
    }

    private String mintRequestId(EvaluationRequest request) {
        return Hashes.sha256(UUID.randomUUID() + ":" + requestCounter.incrementAndGet() + ":" + request.args());
    }

    private String extractJsonObject(String text) {
        if (text == null || text.isBlank()) {
            throw new ScoringModelException("No scoring response returned from model");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new ScoringModelException("No JSON object found in scoring response");
    }

    private String argument(List<String> args, int index) {
        if (args == null || index >= args.size() || args.get(index) == null) {
            return "";
        }
        return args.get(index);
    }

    private record PendingEvaluation(String requestId, EvaluationRequest request) {
    }
}
