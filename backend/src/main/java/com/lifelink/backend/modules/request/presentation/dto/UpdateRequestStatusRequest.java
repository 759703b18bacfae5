package com.lifelink.backend.modules.request.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateRequestStatusRequest(@NotBlank String status) {
}
