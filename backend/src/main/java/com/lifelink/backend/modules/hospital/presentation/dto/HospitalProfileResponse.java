package com.lifelink.backend.modules.hospital.presentation.dto;

import java.util.UUID;

import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.modules.user.presentation.dto.LocationPayload;

public record HospitalProfileResponse(
        UUID id,
        String email,
        String contactName,
        String hospitalName,
        String registrationNumber,
        String licenseNumber,
        String address,
        String contactNumber,
        LocationPayload location
) {

    public static HospitalProfileResponse from(Hospital hospital) {
        return new HospitalProfileResponse(
                hospital.getId(),
                hospital.getUser().getEmail(),
                hospital.getUser().getFullName(),
                hospital.getHospitalName(),
                hospital.getRegistrationNumber(),
                hospital.getLicenseNumber(),
                hospital.getAddress(),
                hospital.getContactNumber(),
                LocationPayload.from(hospital.getLocation())
        );
    }
}
