package com.lifelink.backend.modules.user.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Sign-up payload. Donor fields apply when {@code role} is donor, hospital fields when it is hospital.
 */
public record RegisterRequest(
        @NotBlank @Email @Size(max = 255) String email,
        @NotBlank @Size(min = 8, max = 100) String password,
        @NotBlank @Size(max = 100) String fullName,
        @NotBlank String role,
        @Pattern(regexp = "^\\d{10}$", message = "must be 10 digits") String phoneNumber,
        String gender,
        @Past LocalDate dateOfBirth,
        String bloodType,
        @Valid LocationPayload location,
        @Size(max = 200) String hospitalName,
        @Size(max = 100) String registrationNumber,
        @Size(max = 100) String licenseNumber,
        @Size(max = 255) String address,
        @Size(max = 20) String contactNumber
) {
}
