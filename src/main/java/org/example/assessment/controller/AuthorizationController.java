package org.example.assessment.controller;

import org.example.assessment.config.CallerIdentity;
import org.example.assessment.service.AuthorizationRegistryService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/authorization/callers")
public class AuthorizationController {

    private final AuthorizationRegistryService authorizationRegistry;

    public AuthorizationController(AuthorizationRegistryService authorizationRegistry) {
        this.authorizationRegistry = authorizationRegistry;
    }

    @GetMapping
    public List<String> list() {
        return authorizationRegistry.listCallers();
    }

    @GetMapping("/{identity}")
    public CallerStatus get(@PathVariable String identity) {
        return new CallerStatus(identity, authorizationRegistry.isAuthorized(identity), false);
    }

    @PutMapping("/{identity}")
    public CallerStatus add(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @PathVariable String identity) {
        boolean changed = authorizationRegistry.addCaller(caller, identity);
        return new CallerStatus(identity, true, changed);
    }

    @DeleteMapping("/{identity}")
    public CallerStatus remove(
            @RequestAttribute(CallerIdentity.ATTRIBUTE_NAME) String caller,
            @PathVariable String identity) {
        boolean changed = authorizationRegistry.removeCaller(caller, identity);
        return new CallerStatus(identity, false, changed);
    }

    public record CallerStatus(String caller, boolean authorized, boolean changed) {
    }
}
