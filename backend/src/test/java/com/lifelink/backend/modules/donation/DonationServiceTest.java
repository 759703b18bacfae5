package com.lifelink.backend.modules.donation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.donation.application.DonationCompletedEvent;
import com.lifelink.backend.modules.donation.application.DonationMatchedEvent;
import com.lifelink.backend.modules.donation.application.DonationService;
import com.lifelink.backend.modules.donation.application.DonationService.UpdateDonationStatusCommand;
import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.domain.DonationStatus;
import com.lifelink.backend.modules.donation.infrastructure.persistence.DonationRepository;
import com.lifelink.backend.modules.matching.application.EligibilityEvaluator;
import com.lifelink.backend.modules.matching.application.MatchingProperties;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.Urgency;
import com.lifelink.backend.modules.request.infrastructure.persistence.DonationRequestRepository;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.modules.user.infrastructure.persistence.DonorRepository;
import com.lifelink.backend.support.DomainFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class DonationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private DonationRepository donationRepository;

    @Mock
    private DonorRepository donorRepository;

    @Mock
    private DonationRequestRepository requestRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private EligibilityEvaluator eligibilityEvaluator;
    private DonationService donationService;

    private Hospital hospital;
    private Donor donor;
    private DonationRequest request;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        eligibilityEvaluator = new EligibilityEvaluator(MatchingProperties.defaults(), clock);
        donationService = new DonationService(
                donationRepository,
                donorRepository,
                requestRepository,
                eligibilityEvaluator,
                eventPublisher,
                clock
        );

        hospital = DomainFixtures.hospital();
        donor = DomainFixtures.donor(BloodType.O_POSITIVE);
        request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.CRITICAL);
    }

    @Test
    void createDonationStartsPendingAndNotifiesHospital() {
        stubLookups();
        when(donationRepository.existsByDonorIdAndRequestIdAndStatusNot(donor.getId(), request.getId(), DonationStatus.CANCELLED))
                .thenReturn(false);
        when(donationRepository.saveAndFlush(any(Donation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Donation donation = donationService.createDonation(donor.getId(), request.getId(), null, "first time");

        assertThat(donation.getStatus()).isEqualTo(DonationStatus.PENDING);
        assertThat(donation.getQuantity()).isEqualTo(1);
        assertThat(donation.getNotes()).isEqualTo("first time");

        ArgumentCaptor<DonationMatchedEvent> captor = ArgumentCaptor.forClass(DonationMatchedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().requestId()).isEqualTo(request.getId());
        assertThat(captor.getValue().hospitalUserId()).isEqualTo(hospital.getId());
    }

    @Test
    void createDonationFailsWhenDonorMissing() {
        when(donorRepository.findById(donor.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> donationService.createDonation(donor.getId(), request.getId(), 1, null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("DONOR_NOT_FOUND");
                });
    }

    @Test
    @DisplayName("ineligible donors are rejected with the evaluator reason verbatim")
    void createDonationRejectsIneligibleDonor() {
        donor.setBloodType(BloodType.A_NEGATIVE);
        stubLookups();

        assertThatThrownBy(() -> donationService.createDonation(donor.getId(), request.getId(), 1, null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("DONOR_INELIGIBLE");
                    assertThat(ex.getDetailMessage()).isEqualTo("Donor blood type A- is not compatible with request for O+");
                });
        verify(donationRepository, never()).saveAndFlush(any());
    }

    @Test
    void createDonationRejectsSecondActiveDonation() {
        stubLookups();
        when(donationRepository.existsByDonorIdAndRequestIdAndStatusNot(donor.getId(), request.getId(), DonationStatus.CANCELLED))
                .thenReturn(true);

        assertThatThrownBy(() -> donationService.createDonation(donor.getId(), request.getId(), 1, null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("DONATION_ALREADY_ACTIVE");
                });
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("a lost insert race on the active-donation index surfaces as a conflict")
    void createDonationMapsUniqueIndexViolationToConflict() {
        stubLookups();
        when(donationRepository.existsByDonorIdAndRequestIdAndStatusNot(donor.getId(), request.getId(), DonationStatus.CANCELLED))
                .thenReturn(false);
        when(donationRepository.saveAndFlush(any(Donation.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("ERROR: duplicate key value violates unique constraint \"uq_donation_active_donor_request\"")
        ));

        assertThatThrownBy(() -> donationService.createDonation(donor.getId(), request.getId(), 1, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("DONATION_ALREADY_ACTIVE"));
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void createDonationRethrowsUnrelatedIntegrityViolations() {
        stubLookups();
        when(donationRepository.existsByDonorIdAndRequestIdAndStatusNot(donor.getId(), request.getId(), DonationStatus.CANCELLED))
                .thenReturn(false);
        DataIntegrityViolationException failure = new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("ERROR: new row violates check constraint \"ck_donation_quantity\"")
        );
        when(donationRepository.saveAndFlush(any(Donation.class))).thenThrow(failure);

        assertThatThrownBy(() -> donationService.createDonation(donor.getId(), request.getId(), 1, null))
                .isSameAs(failure);
    }

    @Test
    void createDonationRejectsNonPositiveQuantity() {
        stubLookups();
        when(donationRepository.existsByDonorIdAndRequestIdAndStatusNot(donor.getId(), request.getId(), DonationStatus.CANCELLED))
                .thenReturn(false);

        assertThatThrownBy(() -> donationService.createDonation(donor.getId(), request.getId(), 0, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_QUANTITY"));
    }

    @Test
    void completingDonationRestartsDonorCooldown() {
        Donation donation = DomainFixtures.donation(donor, request);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));

        Donation updated = donationService.updateStatus(donation.getId(), UpdateDonationStatusCommand.of("completed"));

        assertThat(updated.getStatus()).isEqualTo(DonationStatus.COMPLETED);
        assertThat(updated.getCompletedDate()).isEqualTo(NOW);
        assertThat(donor.getLastDonationDate()).isEqualTo(NOW);
        assertThat(eligibilityEvaluator.evaluate(donor, request).reason())
                .isEqualTo("Must wait 56 more days before donating again");
        verify(eventPublisher).publishEvent(eq(new DonationCompletedEvent(donation.getId(), donor.getId())));
    }

    @ParameterizedTest
    @EnumSource(DonationStatus.class)
    void completedDonationRejectsEveryTarget(DonationStatus target) {
        Donation donation = DomainFixtures.donation(donor, request);
        donation.setStatus(DonationStatus.COMPLETED);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));

        assertThatThrownBy(() -> donationService.updateStatus(donation.getId(), UpdateDonationStatusCommand.of(target.getCode())))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("DONATION_STATUS_TERMINAL");
                });
    }

    @ParameterizedTest
    @EnumSource(DonationStatus.class)
    void cancelledDonationRejectsEveryTarget(DonationStatus target) {
        Donation donation = DomainFixtures.donation(donor, request);
        donation.setStatus(DonationStatus.CANCELLED);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));

        assertThatThrownBy(() -> donationService.updateStatus(donation.getId(), UpdateDonationStatusCommand.of(target.getCode())))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("DONATION_STATUS_TERMINAL"));
    }

    @Test
    void unknownStatusIsRejected() {
        Donation donation = DomainFixtures.donation(donor, request);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));

        assertThatThrownBy(() -> donationService.updateStatus(donation.getId(), UpdateDonationStatusCommand.of("approved")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("INVALID_STATUS");
                });
    }

    @Test
    void scheduledDateMustBeInFuture() {
        Donation donation = DomainFixtures.donation(donor, request);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));

        assertThatThrownBy(() -> donationService.updateStatus(donation.getId(),
                new UpdateDonationStatusCommand("scheduled", NOW, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("SCHEDULED_DATE_NOT_IN_FUTURE"));

        Donation scheduled = donationService.updateStatus(donation.getId(),
                new UpdateDonationStatusCommand("scheduled", NOW.plusDays(3), null, "bring ID"));
        assertThat(scheduled.getStatus()).isEqualTo(DonationStatus.SCHEDULED);
        assertThat(scheduled.getScheduledDate()).isEqualTo(NOW.plusDays(3));
        assertThat(scheduled.getNotes()).isEqualTo("bring ID");
    }

    @Test
    void completedDateMustNotBeInFuture() {
        Donation donation = DomainFixtures.donation(donor, request);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));

        assertThatThrownBy(() -> donationService.updateStatus(donation.getId(),
                new UpdateDonationStatusCommand("completed", null, NOW.plusMinutes(1), null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("COMPLETED_DATE_IN_FUTURE"));
        assertThat(donation.getStatus()).isEqualTo(DonationStatus.PENDING);
    }

    @Test
    void hospitalCannotUpdateDonationOfAnotherHospital() {
        Donation donation = DomainFixtures.donation(donor, request);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));
        Hospital other = DomainFixtures.hospital();

        assertThatThrownBy(() -> donationService.updateStatusForHospital(other.getId(), donation.getId(),
                UpdateDonationStatusCommand.of("scheduled")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("DONATION_ACCESS_DENIED");
                });
    }

    @Test
    void donorCanCancelOwnPendingDonation() {
        Donation donation = DomainFixtures.donation(donor, request);
        when(donationRepository.findById(donation.getId())).thenReturn(Optional.of(donation));

        Donation cancelled = donationService.cancelForDonor(donor.getId(), donation.getId());

        assertThat(cancelled.getStatus()).isEqualTo(DonationStatus.CANCELLED);
        assertThat(donor.getLastDonationDate()).isNull();
    }

    private void stubLookups() {
        when(donorRepository.findById(donor.getId())).thenReturn(Optional.of(donor));
        when(requestRepository.findById(request.getId())).thenReturn(Optional.of(request));
    }
}
