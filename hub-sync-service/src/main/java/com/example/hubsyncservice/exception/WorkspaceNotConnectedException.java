package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * No upstream credential has been stored for the workspace (HTTP 412).
 */
public class WorkspaceNotConnectedException extends BaseException {

    public WorkspaceNotConnectedException() {
        super("WORKSPACE_NOT_CONNECTED", "No Linear API token configured for this workspace",
                HttpStatus.PRECONDITION_FAILED);
    }
}
