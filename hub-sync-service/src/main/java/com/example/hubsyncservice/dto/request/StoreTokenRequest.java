package com.example.hubsyncservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record StoreTokenRequest(

    @NotBlank(message = "API token is required")
    @Size(max = 500, message = "API token must not exceed 500 characters")
    String token
) {}
