package com.lifelink.backend.modules.request.presentation.dto;

import java.time.OffsetDateTime;

import com.lifelink.backend.modules.request.application.DonationRequestService.CreateRequestCommand;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateRequestRequest(
        @NotBlank String kind,
        String bloodType,
        String organType,
        String urgency,
        @NotNull OffsetDateTime requiredBy,
        Integer quantity,
        @Size(max = 1000) String notes
) {

    public CreateRequestCommand toCommand() {
        return new CreateRequestCommand(kind, bloodType, organType, urgency, requiredBy, quantity, notes);
    }
}
