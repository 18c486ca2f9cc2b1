package com.example.hubsyncservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateCommentRequest(

    @NotBlank(message = "Comment body is required")
    @Size(max = 50000, message = "Comment body is too long")
    String body
) {}
