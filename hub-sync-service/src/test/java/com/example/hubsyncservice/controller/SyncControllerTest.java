package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.dto.SyncCounts;
import com.example.hubsyncservice.dto.WorkspaceSyncResult;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.exception.AuthorizationDeniedException;
import com.example.hubsyncservice.exception.GlobalExceptionHandler;
import com.example.hubsyncservice.security.AdminAuthGuard;
import com.example.hubsyncservice.service.FullSyncOrchestrator;
import com.example.hubsyncservice.service.IncrementalReconciler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SyncControllerTest {

    @Mock
    private IncrementalReconciler reconciler;

    @Mock
    private FullSyncOrchestrator fullSyncOrchestrator;

    @Mock
    private AdminAuthGuard adminAuthGuard;

    private MockMvc mockMvc(String cronSecret) {
        return MockMvcBuilders.standaloneSetup(
                        new SyncController(reconciler, fullSyncOrchestrator, adminAuthGuard, cronSecret))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testReconcile_CorrectBearerSecret_Runs() throws Exception {
        when(reconciler.reconcileAll(RunTrigger.CRON)).thenReturn(WorkspaceSyncResult.builder()
                .runType("RECONCILE").hubs(2).counts(SyncCounts.builder().issues(4).build()).build());

        mockMvc("s3cret").perform(get("/api/sync/reconcile").header(HttpHeaders.AUTHORIZATION, "Bearer s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hubs").value(2))
                .andExpect(jsonPath("$.counts.issues").value(4));
    }

    @Test
    void testReconcile_WrongOrMissingSecret_Unauthorized() throws Exception {
        MockMvc mockMvc = mockMvc("s3cret");

        mockMvc.perform(get("/api/sync/reconcile").header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/sync/reconcile"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(reconciler);
    }

    @Test
    void testReconcile_NoSecretConfigured_Open() throws Exception {
        when(reconciler.reconcileAll(RunTrigger.CRON)).thenReturn(WorkspaceSyncResult.builder()
                .runType("RECONCILE").counts(new SyncCounts()).build());

        mockMvc("").perform(get("/api/sync/reconcile"))
                .andExpect(status().isOk());
    }

    @Test
    void testInitialSync_NonAdmin_Forbidden() throws Exception {
        when(adminAuthGuard.requireAdmin()).thenThrow(AuthorizationDeniedException.notAnAdmin());

        mockMvc("").perform(post("/api/sync/initial"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(fullSyncOrchestrator);
    }
}
