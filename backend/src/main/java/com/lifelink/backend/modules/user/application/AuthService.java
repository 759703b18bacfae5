package com.lifelink.backend.modules.user.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.user.domain.AppUser;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.domain.Gender;
import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.modules.user.domain.UserRole;
import com.lifelink.backend.modules.user.infrastructure.persistence.AppUserRepository;
import com.lifelink.backend.modules.user.infrastructure.persistence.DonorRepository;
import com.lifelink.backend.modules.user.infrastructure.persistence.HospitalRepository;
import com.lifelink.backend.modules.user.presentation.dto.AccessTokenResponse;
import com.lifelink.backend.modules.user.presentation.dto.LoginRequest;
import com.lifelink.backend.modules.user.presentation.dto.LoginResponse;
import com.lifelink.backend.modules.user.presentation.dto.RegisterRequest;
import com.lifelink.backend.modules.user.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final Pattern PASSWORD_POLICY =
            Pattern.compile("^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&])[A-Za-z\\d@$!%*?&]{8,}$");
    private static final String EMAIL_CONSTRAINT = "uq_app_user_email";

    private final AppUserRepository appUserRepository;
    private final DonorRepository donorRepository;
    private final HospitalRepository hospitalRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            DonorRepository donorRepository,
            HospitalRepository hospitalRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.donorRepository = donorRepository;
        this.hospitalRepository = hospitalRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public LoginResponse register(RegisterRequest request) {
        UserRole role = parseSelfServiceRole(request.role());
        if (!PASSWORD_POLICY.matcher(request.password()).matches()) {
            throw ProblemException.badRequest("WEAK_PASSWORD",
                    "Password must be at least 8 characters with upper and lower case letters, a digit and one of @$!%*?&");
        }

        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw emailTaken();
        }

        AppUser user = new AppUser(email, passwordEncoder.encode(request.password()), request.fullName().trim(), role);
        try {
            user = appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
            if (message != null && message.contains(EMAIL_CONSTRAINT)) {
                throw emailTaken();
            }
            throw ex;
        }

        if (role == UserRole.DONOR) {
            donorRepository.save(buildDonor(user, request));
        } else {
            hospitalRepository.save(buildHospital(user, request));
        }

        log.info("User registered userId={} role={}", user.getId(), role);
        return issueLogin(user);
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password");
        }

        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE", "Account is suspended");
        }

        user.setLastLoginAt(OffsetDateTime.now(clock));
        return issueLogin(user);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        return UserProfileResponse.from(user);
    }

    private LoginResponse issueLogin(AppUser user) {
        AccessTokenResponse tokens = jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), user.getRole());
        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    private Donor buildDonor(AppUser user, RegisterRequest request) {
        if (isBlank(request.phoneNumber()) || request.dateOfBirth() == null) {
            throw ProblemException.badRequest("DONOR_DETAILS_REQUIRED", "Phone number and date of birth are required for donors");
        }
        Donor donor = new Donor(user, request.phoneNumber(), request.dateOfBirth());
        if (!isBlank(request.gender())) {
            donor.setGender(Gender.fromCode(request.gender())
                    .orElseThrow(() -> ProblemException.badRequest("INVALID_GENDER", "Unknown gender: " + request.gender())));
        }
        if (!isBlank(request.bloodType())) {
            donor.setBloodType(BloodType.fromCode(request.bloodType())
                    .orElseThrow(() -> ProblemException.badRequest("INVALID_BLOOD_TYPE", "Unknown blood type: " + request.bloodType())));
        }
        if (request.location() != null) {
            donor.setLocation(request.location().toGeoLocation());
        }
        return donor;
    }

    private Hospital buildHospital(AppUser user, RegisterRequest request) {
        if (isBlank(request.hospitalName()) || isBlank(request.licenseNumber())) {
            throw ProblemException.badRequest("HOSPITAL_DETAILS_REQUIRED", "Hospital name and license number are required for hospitals");
        }
        Hospital hospital = new Hospital(user, request.hospitalName().trim(), request.licenseNumber().trim());
        hospital.setRegistrationNumber(request.registrationNumber());
        hospital.setAddress(request.address());
        hospital.setContactNumber(request.contactNumber());
        if (request.location() != null) {
            hospital.setLocation(request.location().toGeoLocation());
        }
        return hospital;
    }

    private static UserRole parseSelfServiceRole(String rawRole) {
        String normalized = rawRole == null ? "" : rawRole.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "DONOR" -> UserRole.DONOR;
            case "HOSPITAL" -> UserRole.HOSPITAL;
            default -> throw ProblemException.badRequest("INVALID_ROLE", "Role must be donor or hospital");
        };
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ProblemException emailTaken() {
        return ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "Email is already registered");
    }
}
