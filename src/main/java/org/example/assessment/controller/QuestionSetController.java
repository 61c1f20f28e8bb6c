package org.example.assessment.controller;

import org.example.assessment.config.CallerIdentity;
import org.example.assessment.model.QuestionSetMetadata;
import org.example.assessment.service.QuestionCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/question-sets")
public class QuestionSetController {

    private final QuestionCatalogService catalogService;

    public QuestionSetController(QuestionCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<String> list(@RequestParam(defaultValue = "false") boolean activeOnly) {
        return activeOnly ? catalogService.listActive() : catalogService.list();
    }

    @GetMapping("/count")
    public Map<String, Long> count() {
        return Map.of("count", catalogService.questionSetCount());
    }

    @GetMapping("/{setId}")
    public QuestionSetMetadata get(@PathVariable String setId) {
        return catalogService.getQuestionSetMetadata(setId);
    }

    @PostMapping
    public ResponseEntity<QuestionSetMetadata> submit(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody SubmitQuestionSetRequest request) {
        QuestionSetMetadata metadata = catalogService.submitQuestionSet(
                caller, request.setId(), request.contentHash(), request.questionCount());
        return ResponseEntity.status(HttpStatus.CREATED).body(metadata);
    }

    @PostMapping("/{setId}/activate")
    public QuestionSetMetadata activate(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @PathVariable String setId) {
        return catalogService.activate(caller, setId);
    }

    @PostMapping("/{setId}/deactivate")
    public QuestionSetMetadata deactivate(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @PathVariable String setId) {
        return catalogService.deactivate(caller, setId);
    }

    public record SubmitQuestionSetRequest(String setId, String contentHash, int questionCount) {
    }
}
