package org.example.assessment.controller;

import org.example.assessment.config.CallerIdentity;
import org.example.assessment.model.EvaluationResult;
import org.example.assessment.model.OracleConfigView;
import org.example.assessment.model.OracleRequestView;
import org.example.assessment.service.AssessmentError;
import org.example.assessment.service.AssessmentException;
import org.example.assessment.service.EvaluationOracleService;
import org.example.assessment.service.Identities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

@RestController
@RequestMapping("/api/oracle")
public class OracleController {

    private static final Logger log = LoggerFactory.getLogger(OracleController.class);

    private final EvaluationOracleService oracleService;
    private final String routerIdentity;

    public OracleController(
            EvaluationOracleService oracleService,
            @Value("${oracle.router-identity:oracle-router}") String routerIdentity) {
        this.oracleService = oracleService;
        this.routerIdentity = Identities.normalize(routerIdentity);
    }

    @GetMapping("/config")
    public OracleConfigView getConfig() {
        return oracleService.getConfig();
    }

    @PutMapping("/config")
    public OracleConfigView updateConfig(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody ConfigRequest request) {
        return oracleService.updateConfig(
                caller, request.subscriptionId(), decodeHex(request.encryptedSecrets()), request.donId());
    }

    @PutMapping("/source")
    public OracleConfigView updateSource(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody SourceRequest request) {
        return oracleService.updateEvaluationSource(caller, request.source());
    }

    /**
     * Delivery endpoint for external scoring networks; only the configured router may call it.
     */
    @PostMapping("/callback")
    public EvaluationResult callback(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody CallbackRequest request) {
        if (routerIdentity == null || !routerIdentity.equals(caller)) {
            log.warn("Callback for request {} from non-router identity {}", request.requestId(), caller);
            throw new AssessmentException(AssessmentError.CALLER_NOT_AUTHORIZED, "Only the oracle router may deliver results");
        }
        byte[] raw = request.result() == null ? new byte[0] : request.result().getBytes(StandardCharsets.UTF_8);
        return oracleService.onEvaluationCallback(request.requestId(), raw);
    }

    @PostMapping("/manual-result")
    public EvaluationResult submitManualResult(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody ManualResultRequest request) {
        return oracleService.submitManualResult(caller, request.user(), request.resultHash(), request.score());
    }

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<OracleRequestView> getRequest(@PathVariable String requestId) {
        return oracleService.getOutstandingRequest(requestId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/test-evaluation")
    public EvaluationResult testEvaluation(@RequestParam String result) {
        return oracleService.testEvaluation(result);
    }

    private byte[] decodeHex(String value) {
        if (value == null || value.isBlank()) {
            return new byte[0];
        }
        String hex = value.trim();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        return HexFormat.of().parseHex(hex);
    }

    public record ConfigRequest(long subscriptionId, String encryptedSecrets, String donId) {
    }

    public record SourceRequest(String source) {
    }

    public record CallbackRequest(String requestId, String result) {
    }

    public record ManualResultRequest(String user, String resultHash, long score) {
    }
}
