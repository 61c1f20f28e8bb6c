package org.example.assessment.controller;

import org.example.assessment.model.AuditChainStatus;
import org.example.assessment.model.AuditEvent;
import org.example.assessment.service.AuditEventService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditEventService auditEventService;

    public AuditController(AuditEventService auditEventService) {
        this.auditEventService = auditEventService;
    }

    @GetMapping("/events")
    public List<AuditEvent> recentEvents(@RequestParam(defaultValue = "50") int limit) {
        return auditEventService.recentEvents(limit);
    }

    @GetMapping("/verify")
    public AuditChainStatus verify() {
        return auditEventService.verifyChain();
    }
}
