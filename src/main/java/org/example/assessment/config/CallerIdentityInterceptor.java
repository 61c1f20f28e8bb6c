package org.example.assessment.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.example.assessment.service.Identities;
import org.example.assessment.service.LedgerSettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Resolves the acting identity from {@code X-Caller-Id}. Mutating requests must name one, and when an
 * admin API key is configured, requests acting as the owner must also present it. Requests acting as
 * the oracle router must always present the router key; without one configured the router identity
 * cannot be used over HTTP.
 */
@Component
public class CallerIdentityInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CallerIdentityInterceptor.class);
    private static final int MAX_IDENTITY_LENGTH = 120;

    private final LedgerSettingsService settingsService;
    private final String adminApiKey;
    private final String routerIdentity;
    private final String routerApiKey;

    public CallerIdentityInterceptor(
            LedgerSettingsService settingsService,
            @Value("${security.admin.api-key:}") String adminApiKey,
            @Value("${oracle.router-identity:oracle-router}") String routerIdentity,
            @Value("${oracle.router-api-key:}") String routerApiKey) {
        this.settingsService = settingsService;
        this.adminApiKey = adminApiKey;
        this.routerIdentity = Identities.normalize(routerIdentity);
        this.routerApiKey = routerApiKey;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String caller = Identities.normalize(request.getHeader(CallerIdentity.HEADER_NAME));
        if (caller != null && caller.length() > MAX_IDENTITY_LENGTH) {
            writeJson(response, HttpServletResponse.SC_BAD_REQUEST,
                    "{\"error\":\"Caller identity is too long\"}");
            return false;
        }

        if (caller == null) {
            if (isMutating(request.getMethod())) {
                writeJson(response, HttpServletResponse.SC_UNAUTHORIZED,
                        "{\"error\":\"Caller identity required\"}");
                return false;
            }
            return true;
        }

        if (caller.equals(routerIdentity)) {
            String providedRouterKey = request.getHeader(CallerIdentity.ROUTER_KEY_HEADER);
            if (!isConfigured(routerApiKey) || !constantTimeEquals(routerApiKey, providedRouterKey)) {
                log.warn("Router request to {} {} rejected: router key missing or wrong",
                        request.getMethod(), request.getRequestURI());
                writeJson(response, HttpServletResponse.SC_UNAUTHORIZED,
                        "{\"error\":\"Router key required\"}");
                return false;
            }
        } else if (isConfigured(adminApiKey) && settingsService.isOwner(caller)) {
            String providedApiKey = request.getHeader(CallerIdentity.API_KEY_HEADER);
            if (!constantTimeEquals(adminApiKey, providedApiKey)) {
                log.warn("Owner request to {} {} rejected: admin API key missing or wrong",
                        request.getMethod(), request.getRequestURI());
                writeJson(response, HttpServletResponse.SC_UNAUTHORIZED,
                        "{\"error\":\"Admin API key required\"}");
                return false;
            }
        }

        request.setAttribute(CallerIdentity.ATTRIBUTE_NAME, caller);
        return true;
    }

    private boolean isMutating(String method) {
        return !HttpMethod.GET.matches(method)
                && !HttpMethod.HEAD.matches(method)
                && !HttpMethod.OPTIONS.matches(method);
    }

    private boolean isConfigured(String key) {
        return key != null && !key.isBlank();
    }

    private boolean constantTimeEquals(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }

    private void writeJson(HttpServletResponse response, int statusCode, String payload) throws Exception {
        response.setStatus(statusCode);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(payload);
    }
}
