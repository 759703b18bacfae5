package com.lifelink.backend.modules.donation.application;

import java.util.UUID;

/**
 * Published after a donor commits to a request. Carries ids only; listeners reload state.
 */
public record DonationMatchedEvent(UUID donationId, UUID requestId, UUID hospitalUserId) {
}
