package com.lifelink.backend.modules.hospital.presentation.dto;

import java.util.UUID;

import com.lifelink.backend.modules.matching.application.DonorCandidate;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.presentation.dto.LocationPayload;

public record DonorCandidateResponse(
        UUID donorId,
        String fullName,
        BloodType bloodType,
        LocationPayload location,
        double score,
        String reason
) {

    public static DonorCandidateResponse from(DonorCandidate candidate) {
        Donor donor = candidate.donor();
        return new DonorCandidateResponse(
                donor.getId(),
                donor.getUser().getFullName(),
                donor.getBloodType(),
                LocationPayload.from(donor.getLocation()),
                candidate.score(),
                candidate.reason()
        );
    }
}
