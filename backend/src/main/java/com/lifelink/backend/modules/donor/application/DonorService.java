package com.lifelink.backend.modules.donor.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

import com.lifelink.backend.global.common.GeoLocation;
import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.domain.Gender;
import com.lifelink.backend.modules.user.infrastructure.persistence.DonorRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class DonorService {

    private static final Logger log = LoggerFactory.getLogger(DonorService.class);

    private final DonorRepository donorRepository;
    private final Clock clock;

    public DonorService(DonorRepository donorRepository, Clock clock) {
        this.donorRepository = donorRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Donor getProfile(UUID donorId) {
        return loadDonor(donorId);
    }

    /**
     * Partial update; {@code null} fields are left untouched.
     */
    public Donor updateProfile(UUID donorId, UpdateDonorProfileCommand command) {
        Donor donor = loadDonor(donorId);

        if (command.fullName() != null && !command.fullName().isBlank()) {
            donor.getUser().setFullName(command.fullName().trim());
        }
        if (command.phoneNumber() != null) {
            donor.setPhoneNumber(command.phoneNumber());
        }
        if (command.gender() != null) {
            donor.setGender(Gender.fromCode(command.gender())
                    .orElseThrow(() -> ProblemException.badRequest("INVALID_GENDER", "Unknown gender: " + command.gender())));
        }
        if (command.dateOfBirth() != null) {
            if (!command.dateOfBirth().isBefore(LocalDate.now(clock))) {
                throw ProblemException.badRequest("INVALID_DATE_OF_BIRTH", "Date of birth must be in the past");
            }
            donor.setDateOfBirth(command.dateOfBirth());
        }
        if (command.bloodType() != null) {
            donor.setBloodType(BloodType.fromCode(command.bloodType())
                    .orElseThrow(() -> ProblemException.badRequest("INVALID_BLOOD_TYPE", "Unknown blood type: " + command.bloodType())));
        }
        if (command.location() != null) {
            donor.setLocation(command.location());
        }
        return donor;
    }

    public Donor updateAvailability(UUID donorId, boolean available) {
        Donor donor = loadDonor(donorId);
        donor.setAvailable(available);
        log.info("Donor availability changed donorId={} available={}", donorId, available);
        return donor;
    }

    private Donor loadDonor(UUID donorId) {
        return donorRepository.findById(donorId)
                .orElseThrow(() -> ProblemException.notFound("DONOR_NOT_FOUND"));
    }

    public record UpdateDonorProfileCommand(
            String fullName,
            String phoneNumber,
            String gender,
            LocalDate dateOfBirth,
            String bloodType,
            GeoLocation location
    ) {
    }
}
