package com.example.hubsyncservice.security;

import com.example.hubsyncservice.controller.HubReadController;
import com.example.hubsyncservice.controller.SyncController;
import com.example.hubsyncservice.controller.WebhookController;
import com.example.hubsyncservice.entity.HubMember.MemberRole;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.entity.WebhookSubscription;
import com.example.hubsyncservice.service.FullSyncOrchestrator;
import com.example.hubsyncservice.service.HubLiveReadService;
import com.example.hubsyncservice.service.HubReadService;
import com.example.hubsyncservice.service.IncrementalReconciler;
import com.example.hubsyncservice.webhook.WebhookEventRouter;
import com.example.hubsyncservice.webhook.WebhookSignatureVerifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * The filter chain alone: which endpoints need a bearer token before any controller runs.
 */
@WebMvcTest(controllers = {WebhookController.class, SyncController.class, HubReadController.class})
@Import({SecurityConfig.class, JwtAuthenticationFilter.class, JwtAuthenticationEntryPoint.class})
class SecurityConfigTest {

    private static final UUID HUB_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JwtService jwtService;

    @MockBean
    private WebhookSignatureVerifier signatureVerifier;

    @MockBean
    private WebhookEventRouter eventRouter;

    @MockBean
    private IncrementalReconciler reconciler;

    @MockBean
    private FullSyncOrchestrator fullSyncOrchestrator;

    @MockBean
    private AdminAuthGuard adminAuthGuard;

    @MockBean
    private HubAuthGuard hubAuthGuard;

    @MockBean
    private HubReadService readService;

    @MockBean
    private HubLiveReadService liveReadService;

    @Test
    void testWebhook_ReachableWithoutBearerToken() throws Exception {
        when(signatureVerifier.verify(any(), eq("abc123"), any()))
                .thenReturn(Optional.of(WebhookSubscription.builder().webhookId("wh-1").build()));

        mockMvc.perform(post("/api/webhooks/linear")
                        .with(anonymous())
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("linear-signature", "abc123")
                        .content("{\"action\":\"update\",\"type\":\"Issue\",\"data\":{\"id\":\"issue-1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(eventRouter).route(any());
    }

    @Test
    void testCronReconcile_ReachableWithoutBearerToken() throws Exception {
        mockMvc.perform(get("/api/sync/reconcile").with(anonymous()))
                .andExpect(status().isOk());

        verify(reconciler).reconcileAll(RunTrigger.CRON);
    }

    @Test
    void testInitialSync_RequiresToken() throws Exception {
        mockMvc.perform(post("/api/sync/initial").with(anonymous()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));

        verifyNoInteractions(fullSyncOrchestrator, adminAuthGuard);
    }

    @Test
    void testHubRead_WithoutToken_401BeforeController() throws Exception {
        mockMvc.perform(get("/api/hubs/{hubId}/issues", HUB_ID).with(anonymous()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));

        verify(hubAuthGuard, never()).authorize(any());
        verifyNoInteractions(readService);
    }

    @Test
    @WithMockUser(username = "identity-1")
    void testHubRead_Authenticated_PassesToHubGuard() throws Exception {
        when(hubAuthGuard.authorize(HUB_ID)).thenReturn(HubAuthResult.granted(
                new AuthenticatedIdentity("identity-1", "client@alpha.example", "Client"), HUB_ID, MemberRole.DEFAULT));
        when(readService.listIssues(eq(HUB_ID), any())).thenReturn(List.of());

        mockMvc.perform(get("/api/hubs/{hubId}/issues", HUB_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(hubAuthGuard).authorize(HUB_ID);
    }
}
