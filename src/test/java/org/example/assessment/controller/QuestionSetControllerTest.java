package org.example.assessment.controller;

import org.example.assessment.model.QuestionSetMetadata;
import org.example.assessment.service.AssessmentError;
import org.example.assessment.service.AssessmentException;
import org.example.assessment.service.LedgerSettingsService;
import org.example.assessment.service.QuestionCatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QuestionSetController.class)
class QuestionSetControllerTest {

    private static final String OWNER = "0x00000000000000000000000000000000000000a1";
    private static final String CONTENT_HASH = "0x" + "c0".repeat(32);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuestionCatalogService catalogService;

    @MockitoBean
    private LedgerSettingsService settingsService;

    @Test
    void submit_byOwner_returnsCreated() throws Exception {
        when(catalogService.submitQuestionSet(OWNER, "univ2", CONTENT_HASH, 5)).thenReturn(metadata(true));

        mockMvc.perform(post("/api/question-sets")
                        .header("X-Caller-Id", OWNER)
                        .contentType("application/json")
                        .content("{\"setId\":\"univ2\",\"contentHash\":\"" + CONTENT_HASH + "\",\"questionCount\":5}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.setId", is("univ2")))
                .andExpect(jsonPath("$.active", is(true)))
                .andExpect(jsonPath("$.questionCount", is(5)));
    }

    @Test
    void submit_duplicate_returnsConflict() throws Exception {
        when(catalogService.submitQuestionSet(OWNER, "univ2", CONTENT_HASH, 5))
                .thenThrow(new AssessmentException(AssessmentError.DUPLICATE_ID));

        mockMvc.perform(post("/api/question-sets")
                        .header("X-Caller-Id", OWNER)
                        .contentType("application/json")
                        .content("{\"setId\":\"univ2\",\"contentHash\":\"" + CONTENT_HASH + "\",\"questionCount\":5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("DUPLICATE_ID")));
    }

    @Test
    void submit_malformedBody_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/question-sets")
                        .header("X-Caller-Id", OWNER)
                        .contentType("application/json")
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("BAD_REQUEST")));

        verifyNoInteractions(catalogService);
    }

    @Test
    void list_activeOnly_usesActiveListing() throws Exception {
        when(catalogService.listActive()).thenReturn(List.of("univ2", "v3"));

        mockMvc.perform(get("/api/question-sets").param("activeOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", contains("univ2", "v3")));

        verify(catalogService).listActive();
    }

    @Test
    void count_reportsCatalogSize() throws Exception {
        when(catalogService.questionSetCount()).thenReturn(2L);

        mockMvc.perform(get("/api/question-sets/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(2)));
    }

    @Test
    void deactivate_delegatesWithCaller() throws Exception {
        when(catalogService.deactivate(OWNER, "univ2")).thenReturn(metadata(false));

        mockMvc.perform(post("/api/question-sets/univ2/deactivate").header("X-Caller-Id", OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active", is(false)));
    }

    @Test
    void get_unknownSet_returnsNotFound() throws Exception {
        when(catalogService.getQuestionSetMetadata("missing"))
                .thenThrow(new AssessmentException(AssessmentError.SET_NOT_FOUND));

        mockMvc.perform(get("/api/question-sets/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("SET_NOT_FOUND")));
    }

    private static QuestionSetMetadata metadata(boolean active) {
        return new QuestionSetMetadata("univ2", CONTENT_HASH, 5, active, LocalDateTime.of(2026, 3, 1, 9, 0));
    }
}
