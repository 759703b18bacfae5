package com.lifelink.backend.modules.hospital.application;

import java.util.UUID;

import com.lifelink.backend.global.common.GeoLocation;
import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.modules.user.infrastructure.persistence.HospitalRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class HospitalService {

    private final HospitalRepository hospitalRepository;

    public HospitalService(HospitalRepository hospitalRepository) {
        this.hospitalRepository = hospitalRepository;
    }

    @Transactional(readOnly = true)
    public Hospital getProfile(UUID hospitalId) {
        return loadHospital(hospitalId);
    }

    public Hospital updateProfile(UUID hospitalId, UpdateHospitalProfileCommand command) {
        Hospital hospital = loadHospital(hospitalId);
        if (command.hospitalName() != null && !command.hospitalName().isBlank()) {
            hospital.setHospitalName(command.hospitalName().trim());
        }
        if (command.registrationNumber() != null) {
            hospital.setRegistrationNumber(command.registrationNumber());
        }
        if (command.licenseNumber() != null && !command.licenseNumber().isBlank()) {
            hospital.setLicenseNumber(command.licenseNumber().trim());
        }
        if (command.address() != null) {
            hospital.setAddress(command.address());
        }
        if (command.contactNumber() != null) {
            hospital.setContactNumber(command.contactNumber());
        }
        if (command.location() != null) {
            hospital.setLocation(command.location());
        }
        return hospital;
    }

    private Hospital loadHospital(UUID hospitalId) {
        return hospitalRepository.findById(hospitalId)
                .orElseThrow(() -> ProblemException.notFound("HOSPITAL_NOT_FOUND"));
    }

    public record UpdateHospitalProfileCommand(
            String hospitalName,
            String registrationNumber,
            String licenseNumber,
            String address,
            String contactNumber,
            GeoLocation location
    ) {
    }
}
