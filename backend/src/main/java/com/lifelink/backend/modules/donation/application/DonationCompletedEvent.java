package com.lifelink.backend.modules.donation.application;

import java.util.UUID;

public record DonationCompletedEvent(UUID donationId, UUID donorId) {
}
