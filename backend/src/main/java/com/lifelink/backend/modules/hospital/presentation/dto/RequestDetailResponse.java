package com.lifelink.backend.modules.hospital.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.presentation.dto.DonationResponse;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.request.presentation.dto.RequestResponse;

public record RequestDetailResponse(
        RequestResponse request,
        List<RespondingDonation> donations
) {

    public record RespondingDonation(
            DonationResponse donation,
            UUID donorId,
            String donorName,
            String donorPhoneNumber,
            BloodType donorBloodType
    ) {

        public static RespondingDonation from(Donation donation) {
            return new RespondingDonation(
                    DonationResponse.from(donation),
                    donation.getDonor().getId(),
                    donation.getDonor().getUser().getFullName(),
                    donation.getDonor().getPhoneNumber(),
                    donation.getDonor().getBloodType()
            );
        }
    }
}
