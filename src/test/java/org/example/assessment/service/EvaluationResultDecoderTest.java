package org.example.assessment.service;

import org.example.assessment.model.EvaluationResult;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EvaluationResultDecoderTest {

    private static final String HASH = "0x" + "ab".repeat(32);

    private final EvaluationResultDecoder decoder = new EvaluationResultDecoder();

    @Test
    void decode_wellFormedPayload_returnsScoreAndHash() {
        EvaluationResult result = decoder.decode(("85," + HASH).getBytes(StandardCharsets.UTF_8));

        assertEquals(85, result.score());
        assertEquals(HASH, result.resultHash());
    }

    @Test
    void decode_trimsWhitespaceAndLowercasesHash() {
        EvaluationResult result = decoder.decode("  42 , 0x" + "AB".repeat(32) + "\n");

        assertEquals(42, result.score());
        assertEquals(HASH, result.resultHash());
    }

    @Test
    void decode_scoreAboveHundred_isClamped() {
        assertEquals(100, decoder.decode("250," + HASH).score());
        assertEquals(100, decoder.decode("99999999999999999999," + HASH).score());
    }

    @Test
    void decode_missingPrefix_isRejected() {
        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> decoder.decode("90," + "ab".repeat(33)));

        assertEquals(AssessmentError.MALFORMED_EVALUATION_RESULT, ex.getError());
        assertEquals("Hash must start with 0x prefix", ex.getMessage());
    }

    @Test
    void decode_wrongHashLength_isRejected() {
        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> decoder.decode("90,0x" + "ab".repeat(31)));

        assertEquals("Hash must be 32 bytes", ex.getMessage());
    }

    @Test
    void decode_nonHexHash_isRejected() {
        AssessmentException ex = assertThrows(AssessmentException.class,
                () -> decoder.decode("90,0x" + "zz".repeat(32)));

        assertEquals(AssessmentError.MALFORMED_EVALUATION_RESULT, ex.getError());
    }

    @Test
    void decode_nonAsciiDigitsInHash_areRejected() {
        AssessmentException arabicIndic = assertThrows(AssessmentException.class,
                () -> decoder.decode("90,0x" + "\u0663".repeat(64)));
        AssessmentException fullwidth = assertThrows(AssessmentException.class,
                () -> decoder.decode("90,0x" + "\uFF21".repeat(64)));

        assertEquals(AssessmentError.MALFORMED_EVALUATION_RESULT, arabicIndic.getError());
        assertEquals("Hash must be hexadecimal", arabicIndic.getMessage());
        assertEquals(AssessmentError.MALFORMED_EVALUATION_RESULT, fullwidth.getError());
    }

    @Test
    void decode_negativeOrNonNumericScore_isRejected() {
        assertThrows(AssessmentException.class, () -> decoder.decode("-5," + HASH));
        assertThrows(AssessmentException.class, () -> decoder.decode("ninety," + HASH));
        assertThrows(AssessmentException.class, () -> decoder.decode("," + HASH));
    }

    @Test
    void decode_missingOrExtraSeparator_isRejected() {
        assertThrows(AssessmentException.class, () -> decoder.decode("90 " + HASH));
        assertThrows(AssessmentException.class, () -> decoder.decode("90," + HASH + ",extra"));
    }

    @Test
    void decode_emptyPayload_isRejected() {
        assertThrows(AssessmentException.class, () -> decoder.decode(new byte[0]));
        assertThrows(AssessmentException.class, () -> decoder.decode("   "));
    }

    @Test
    void clampScore_boundsToZeroAndHundred() {
        assertEquals(0, EvaluationResultDecoder.clampScore(-1));
        assertEquals(0, EvaluationResultDecoder.clampScore(0));
        assertEquals(70, EvaluationResultDecoder.clampScore(70));
        assertEquals(100, EvaluationResultDecoder.clampScore(101));
    }
}
