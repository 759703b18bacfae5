package com.lifelink.backend.modules.donor.presentation.dto;

import java.time.LocalDate;

import com.lifelink.backend.modules.donor.application.DonorService.UpdateDonorProfileCommand;
import com.lifelink.backend.modules.user.presentation.dto.LocationPayload;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateDonorProfileRequest(
        @Size(max = 100) String fullName,
        @Pattern(regexp = "^\\d{10}$", message = "must be 10 digits") String phoneNumber,
        String gender,
        @Past LocalDate dateOfBirth,
        String bloodType,
        @Valid LocationPayload location
) {

    public UpdateDonorProfileCommand toCommand() {
        return new UpdateDonorProfileCommand(
                fullName,
                phoneNumber,
                gender,
                dateOfBirth,
                bloodType,
                location != null ? location.toGeoLocation() : null
        );
    }
}
