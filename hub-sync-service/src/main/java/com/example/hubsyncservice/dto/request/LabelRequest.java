package com.example.hubsyncservice.dto.request;

import jakarta.validation.constraints.NotBlank;

public record LabelRequest(

    @NotBlank(message = "Label ID is required")
    String labelId
) {}
