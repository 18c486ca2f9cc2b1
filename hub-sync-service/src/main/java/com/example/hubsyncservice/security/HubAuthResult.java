package com.example.hubsyncservice.security;

import com.example.hubsyncservice.entity.HubMember.MemberRole;
import com.example.hubsyncservice.exception.AuthenticationRequiredException;
import com.example.hubsyncservice.exception.AuthorizationDeniedException;
import com.example.hubsyncservice.exception.BaseException;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Outcome of a hub authorization check: either a {@link HubAccess} or a denial with its reason
 * and HTTP status (401, 403 or 404).
 */
@Getter
public final class HubAuthResult {

    private final HubAccess access;
    private final Denial denial;
    private final UUID hubId;

    private HubAuthResult(HubAccess access, Denial denial, UUID hubId) {
        this.access = access;
        this.denial = denial;
        this.hubId = hubId;
    }

    public static HubAuthResult granted(AuthenticatedIdentity identity, UUID hubId, MemberRole role) {
        return new HubAuthResult(new HubAccess(identity, hubId, role), null, hubId);
    }

    public static HubAuthResult denied(UUID hubId, Denial denial) {
        return new HubAuthResult(null, denial, hubId);
    }

    public boolean isGranted() {
        return access != null;
    }

    public HttpStatus getStatus() {
        return isGranted() ? HttpStatus.OK : denial.getStatus();
    }

    /**
     * Write variant: VIEW_ONLY members are denied.
     */
    public HubAuthResult requireWrite() {
        if (isGranted() && !access.canWrite()) {
            return denied(hubId, Denial.VIEW_ONLY);
        }
        return this;
    }

    public HubAccess orElseThrow() {
        if (isGranted()) {
            return access;
        }
        throw toException();
    }

    private BaseException toException() {
        return switch (denial) {
            case UNAUTHENTICATED -> AuthenticationRequiredException.notSignedIn();
            case HUB_NOT_FOUND -> ResourceNotFoundException.hub(hubId);
            case NOT_A_MEMBER -> AuthorizationDeniedException.notAMember();
            case VIEW_ONLY -> AuthorizationDeniedException.viewOnly();
        };
    }

    @Getter
    public enum Denial {
        UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Unauthorized"),
        HUB_NOT_FOUND(HttpStatus.NOT_FOUND, "Hub not found"),
        NOT_A_MEMBER(HttpStatus.FORBIDDEN, "Not a member of this hub"),
        VIEW_ONLY(HttpStatus.FORBIDDEN, "View-only users cannot perform this action");

        private final HttpStatus status;
        private final String reason;

        Denial(HttpStatus status, String reason) {
            this.status = status;
            this.reason = reason;
        }
    }
}
