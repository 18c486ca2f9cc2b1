package com.example.hubsyncservice.dto.request;

import com.example.hubsyncservice.entity.HubMember.MemberRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record InviteMemberRequest(

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    String email,

    MemberRole role
) {}
