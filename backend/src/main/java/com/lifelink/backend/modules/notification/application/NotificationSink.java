package com.lifelink.backend.modules.notification.application;

import java.util.Collection;
import java.util.UUID;

import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.request.domain.DonationRequest;

/**
 * Delivery side of notifications. Callers treat it as fire-and-forget.
 */
public interface NotificationSink {

    void notifyMatch(UUID hospitalUserId, Donation donation, DonationRequest request);

    void notifyRequestBroadcast(Collection<UUID> donorIds, DonationRequest request);

    void notifyMilestone(UUID userId, Achievement achievement);
}
