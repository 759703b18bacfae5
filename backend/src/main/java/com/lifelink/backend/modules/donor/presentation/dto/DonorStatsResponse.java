package com.lifelink.backend.modules.donor.presentation.dto;

import com.lifelink.backend.modules.donation.application.DonationService.DonorStats;

public record DonorStatsResponse(
        long totalDonations,
        long completedDonations,
        long pendingDonations,
        long scheduledDonations,
        long totalUnitsDonated
) {

    public static DonorStatsResponse from(DonorStats stats) {
        return new DonorStatsResponse(
                stats.totalDonations(),
                stats.completedDonations(),
                stats.pendingDonations(),
                stats.scheduledDonations(),
                stats.totalUnitsDonated()
        );
    }
}
