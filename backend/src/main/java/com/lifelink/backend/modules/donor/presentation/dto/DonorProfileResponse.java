package com.lifelink.backend.modules.donor.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.domain.Gender;
import com.lifelink.backend.modules.user.presentation.dto.LocationPayload;

public record DonorProfileResponse(
        UUID id,
        String email,
        String fullName,
        String phoneNumber,
        Gender gender,
        BloodType bloodType,
        boolean available,
        OffsetDateTime lastDonationDate,
        LocationPayload location,
        LocalDate dateOfBirth
) {

    public static DonorProfileResponse from(Donor donor) {
        return new DonorProfileResponse(
                donor.getId(),
                donor.getUser().getEmail(),
                donor.getUser().getFullName(),
                donor.getPhoneNumber(),
                donor.getGender(),
                donor.getBloodType(),
                donor.isAvailable(),
                donor.getLastDonationDate(),
                LocationPayload.from(donor.getLocation()),
                donor.getDateOfBirth()
        );
    }
}
