package org.example.assessment.controller;

import org.example.assessment.config.CallerIdentity;
import org.example.assessment.service.LedgerSettingsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final LedgerSettingsService settingsService;

    public AdminController(LedgerSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/owner")
    public Map<String, String> owner() {
        return Map.of("owner", settingsService.getOwner());
    }

    @PutMapping("/owner")
    public Map<String, String> transferOwnership(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @RequestBody TransferOwnershipRequest request) {
        return Map.of("owner", settingsService.transferOwnership(caller, request.newOwner()));
    }

    public record TransferOwnershipRequest(String newOwner) {
    }
}
