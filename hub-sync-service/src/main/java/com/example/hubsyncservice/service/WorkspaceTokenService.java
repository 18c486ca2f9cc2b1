package com.example.hubsyncservice.service;

import com.example.hubsyncservice.entity.WorkspaceSetting;
import com.example.hubsyncservice.exception.WorkspaceNotConnectedException;
import com.example.hubsyncservice.repository.WorkspaceSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The workspace's Linear API token, stored AES-GCM encrypted in {@code workspace_settings}.
 */
@Service
@Slf4j
public class WorkspaceTokenService {

    private final WorkspaceSettingRepository settingRepository;
    private final SecretEncryptionService encryptionService;
    private final String workspaceId;

    public WorkspaceTokenService(WorkspaceSettingRepository settingRepository,
                                 SecretEncryptionService encryptionService,
                                 @Value("${hub.workspace-id:workspace}") String workspaceId) {
        this.settingRepository = settingRepository;
        this.encryptionService = encryptionService;
        this.workspaceId = workspaceId;
    }

    /**
     * @throws WorkspaceNotConnectedException when no token has been stored
     */
    @Transactional(readOnly = true)
    public String getToken() {
        return settingRepository.findByWorkspaceIdAndKey(workspaceId, WorkspaceSetting.LINEAR_API_TOKEN)
                .map(setting -> encryptionService.decrypt(setting.getEncryptedValue()))
                .orElseThrow(WorkspaceNotConnectedException::new);
    }

    @Transactional(readOnly = true)
    public boolean isConnected() {
        return settingRepository.findByWorkspaceIdAndKey(workspaceId, WorkspaceSetting.LINEAR_API_TOKEN).isPresent();
    }

    @Transactional
    public void storeToken(String token) {
        String encrypted = encryptionService.encrypt(token.trim());
        WorkspaceSetting setting = settingRepository
                .findByWorkspaceIdAndKey(workspaceId, WorkspaceSetting.LINEAR_API_TOKEN)
                .orElseGet(() -> WorkspaceSetting.builder()
                        .workspaceId(workspaceId)
                        .key(WorkspaceSetting.LINEAR_API_TOKEN)
                        .build());
        setting.setEncryptedValue(encrypted);
        settingRepository.save(setting);
        log.info("✅ Linear API token stored for workspace {}", workspaceId);
    }
}
