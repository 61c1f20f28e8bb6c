package org.example.assessment.service;

import org.example.assessment.model.EvaluationResult;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Decodes scoring network payloads of the form {@code "<score>,<0x-prefixed 64 hex digest>"}.
 */
@Component
public class EvaluationResultDecoder {

    static final int MAX_SCORE = 100;

    public EvaluationResult decode(byte[] rawResult) {
        if (rawResult == null || rawResult.length == 0) {
            throw malformed("Result payload is empty");
        }
        return decode(new String(rawResult, StandardCharsets.UTF_8));
    }

    public EvaluationResult decode(String rawResult) {
        String text = rawResult == null ? "" : rawResult.trim();
        if (text.isEmpty()) {
            throw malformed("Result payload is empty");
        }

        int comma = text.indexOf(',');
        if (comma < 0 || comma != text.lastIndexOf(',')) {
            throw malformed("Result must be formatted as <score>,<hash>");
        }

        String scoreText = text.substring(0, comma).trim();
        String hashText = text.substring(comma + 1).trim();
        return new EvaluationResult(parseScore(scoreText), parseHash(hashText));
    }

    public static int clampScore(long score) {
        if (score < 0) {
            return 0;
        }
        return (int) Math.min(score, MAX_SCORE);
    }

    private int parseScore(String scoreText) {
        if (scoreText.isEmpty()) {
            throw malformed("Score is missing");
        }
        for (int i = 0; i < scoreText.length(); i++) {
            char c = scoreText.charAt(i);
            if (c < '0' || c > '9') {
                throw malformed("Score must be an unsigned integer");
            }
        }
        return new BigInteger(scoreText).min(BigInteger.valueOf(MAX_SCORE)).intValue();
    }

    private String parseHash(String hashText) {
        if (!hashText.startsWith("0x")) {
            throw malformed("Hash must start with 0x prefix");
        }
        if (hashText.length() != 66) {
            throw malformed("Hash must be 32 bytes");
        }
        if (!Hashes.isWellFormed(hashText)) {
            throw malformed("Hash must be hexadecimal");
        }
        return hashText.toLowerCase(Locale.ROOT);
    }

    private AssessmentException malformed(String reason) {
        return new AssessmentException(AssessmentError.MALFORMED_EVALUATION_RESULT, reason);
    }
}
