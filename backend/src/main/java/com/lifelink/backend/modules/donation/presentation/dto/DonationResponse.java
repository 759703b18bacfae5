package com.lifelink.backend.modules.donation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.domain.DonationStatus;

public record DonationResponse(
        UUID id,
        UUID donorId,
        UUID requestId,
        DonationStatus status,
        int quantity,
        OffsetDateTime scheduledDate,
        OffsetDateTime completedDate,
        String notes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static DonationResponse from(Donation donation) {
        return new DonationResponse(
                donation.getId(),
                donation.getDonor().getId(),
                donation.getRequest().getId(),
                donation.getStatus(),
                donation.getQuantity(),
                donation.getScheduledDate(),
                donation.getCompletedDate(),
                donation.getNotes(),
                donation.getCreatedAt(),
                donation.getUpdatedAt()
        );
    }
}
