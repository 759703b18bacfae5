package com.lifelink.backend.modules.donation.presentation.dto;

import java.time.OffsetDateTime;

import com.lifelink.backend.modules.donation.application.DonationService.UpdateDonationStatusCommand;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateDonationStatusRequest(
        @NotBlank String status,
        OffsetDateTime scheduledDate,
        OffsetDateTime completedDate,
        @Size(max = 1000) String notes
) {

    public UpdateDonationStatusCommand toCommand() {
        return new UpdateDonationStatusCommand(status, scheduledDate, completedDate, notes);
    }
}
