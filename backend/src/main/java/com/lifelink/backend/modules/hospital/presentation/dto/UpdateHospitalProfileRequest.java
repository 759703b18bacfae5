package com.lifelink.backend.modules.hospital.presentation.dto;

import com.lifelink.backend.modules.hospital.application.HospitalService.UpdateHospitalProfileCommand;
import com.lifelink.backend.modules.user.presentation.dto.LocationPayload;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

public record UpdateHospitalProfileRequest(
        @Size(max = 200) String hospitalName,
        @Size(max = 100) String registrationNumber,
        @Size(max = 100) String licenseNumber,
        @Size(max = 255) String address,
        @Size(max = 20) String contactNumber,
        @Valid LocationPayload location
) {

    public UpdateHospitalProfileCommand toCommand() {
        return new UpdateHospitalProfileCommand(
                hospitalName,
                registrationNumber,
                licenseNumber,
                address,
                contactNumber,
                location != null ? location.toGeoLocation() : null
        );
    }
}
