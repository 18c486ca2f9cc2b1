package com.example.hubsyncservice.dto.request;

import com.example.hubsyncservice.entity.HubMember.MemberRole;
import jakarta.validation.constraints.NotNull;

public record UpdateMemberRoleRequest(

    @NotNull(message = "Role is required")
    MemberRole role
) {}
