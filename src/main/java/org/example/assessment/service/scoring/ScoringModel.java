package org.example.assessment.service.scoring;

/**
 * Abstraction for the language model that grades answers (Ollama, xAI).
 */
public interface ScoringModel {

    /**
     * Ask the model to grade according to the prompt.
     *
     * @param prompt the grading instructions and answer references
     * @param options generation options
     * @return the raw model output, expected to contain a JSON object
     */
    String evaluate(String prompt, ScoringOptions options);

    /**
     * Check if this model is reachable and configured.
     */
    boolean isAvailable();

    /**
     * Name used in logs and health output (e.g. "ollama", "xai").
     */
    String getModelName();
}
