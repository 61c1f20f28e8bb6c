package org.example.assessment.controller;

import org.example.assessment.service.AuthorizationRegistryService;
import org.example.assessment.service.LedgerSettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({AuthorizationController.class, AdminController.class})
@TestPropertySource(properties = "security.admin.api-key=test-key")
class CallerIdentityInterceptorAdminKeyTest {

    private static final String OWNER = "0x00000000000000000000000000000000000000a1";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AuthorizationRegistryService authorizationRegistry;

    @MockitoBean
    private LedgerSettingsService settingsService;

    @Test
    void ownerRequest_withoutApiKey_returnsUnauthorized() throws Exception {
        when(settingsService.isOwner(OWNER)).thenReturn(true);

        mockMvc.perform(put("/api/authorization/callers/assessment-manager").header("X-Caller-Id", OWNER))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error", is("Admin API key required")));

        verifyNoInteractions(authorizationRegistry);
    }

    @Test
    void ownerRequest_withWrongApiKey_returnsUnauthorized() throws Exception {
        when(settingsService.isOwner(OWNER)).thenReturn(true);

        mockMvc.perform(put("/api/authorization/callers/assessment-manager")
                        .header("X-Caller-Id", OWNER)
                        .header("X-API-Key", "guess"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(authorizationRegistry);
    }

    @Test
    void ownerRequest_withApiKey_reachesController() throws Exception {
        when(settingsService.isOwner(OWNER)).thenReturn(true);
        when(authorizationRegistry.addCaller(OWNER, "assessment-manager")).thenReturn(true);

        mockMvc.perform(put("/api/authorization/callers/assessment-manager")
                        .header("X-Caller-Id", OWNER)
                        .header("X-API-Key", "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authorized", is(true)))
                .andExpect(jsonPath("$.changed", is(true)));
    }

    @Test
    void nonOwnerRequest_doesNotNeedApiKey() throws Exception {
        when(settingsService.isOwner("0xa11ce")).thenReturn(false);
        when(authorizationRegistry.removeCaller("0xa11ce", "assessment-manager")).thenReturn(false);

        mockMvc.perform(delete("/api/authorization/callers/assessment-manager").header("X-Caller-Id", "0xa11ce"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed", is(false)));

        verify(authorizationRegistry).removeCaller("0xa11ce", "assessment-manager");
    }

    @Test
    void routerIdentity_withoutConfiguredRouterKey_isRefused() throws Exception {
        mockMvc.perform(put("/api/authorization/callers/assessment-manager")
                        .header("X-Caller-Id", "oracle-router")
                        .header("X-Router-Key", ""))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error", is("Router key required")));

        verifyNoInteractions(authorizationRegistry);
    }

    @Test
    void anonymousRead_isAllowed() throws Exception {
        when(settingsService.getOwner()).thenReturn(OWNER);

        mockMvc.perform(get("/api/admin/owner"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner", is(OWNER)));
    }

    @Test
    void oversizedCallerIdentity_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/admin/owner").header("X-Caller-Id", "x".repeat(121)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void ownershipTransfer_withApiKey_returnsNewOwner() throws Exception {
        when(settingsService.isOwner(OWNER)).thenReturn(true);
        when(settingsService.transferOwnership(OWNER, "0xB0B")).thenReturn("0xb0b");

        mockMvc.perform(put("/api/admin/owner")
                        .header("X-Caller-Id", OWNER)
                        .header("X-API-Key", "test-key")
                        .contentType("application/json")
                        .content("{\"newOwner\":\"0xB0B\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner", is("0xb0b")));
    }
}
