package com.lifelink.backend.modules.donation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.donation.application.DonationService;
import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.domain.DonationStatus;
import com.lifelink.backend.modules.donation.infrastructure.persistence.DonationRepository;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.request.application.DonationRequestService;
import com.lifelink.backend.modules.request.application.DonationRequestService.CreateRequestCommand;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.support.AbstractPostgresIntegrationTest;
import com.lifelink.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class DonationConcurrencyIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private DonationRequestService requestService;

    @Autowired
    private DonationService donationService;

    @Autowired
    private DonationRepository donationRepository;

    private Hospital hospital;
    private Donor donor;
    private DonationRequest request;

    @BeforeEach
    void setUp() {
        hospital = testUserFactory.createHospital("race-hospital@example.com");
        donor = testUserFactory.createDonor("race-donor@example.com", BloodType.O_NEGATIVE);
        request = requestService.createRequest(hospital.getId(), new CreateRequestCommand(
                "blood", "A+", null, "high", OffsetDateTime.now(ZoneOffset.UTC).plusDays(3), 1, null));
    }

    @RepeatedTest(3)
    void concurrentResponsesYieldExactlyOneDonation() throws Exception {
        int attempts = 4;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<Donation>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                Callable<Donation> attempt = () -> {
                    startGate.await();
                    return donationService.createDonation(donor.getId(), request.getId(), 1, null);
                };
                futures.add(executor.submit(attempt));
            }
            startGate.countDown();

            int successes = 0;
            List<String> conflictCodes = new ArrayList<>();
            for (Future<Donation> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOf(ProblemException.class);
                    conflictCodes.add(((ProblemException) ex.getCause()).getCode());
                }
            }

            assertThat(successes).isEqualTo(1);
            assertThat(conflictCodes).hasSize(attempts - 1).containsOnly("DONATION_ALREADY_ACTIVE");
        } finally {
            executor.shutdownNow();
        }

        assertThat(donationRepository.existsByDonorIdAndRequestIdAndStatusNot(donor.getId(), request.getId(), DonationStatus.CANCELLED))
                .isTrue();
        assertThat(donationRepository.findActiveDonorIdsByRequestId(request.getId())).containsExactly(donor.getId());
    }

    @Test
    void cancelledDonationDoesNotBlockNewResponse() {
        Donation first = donationService.createDonation(donor.getId(), request.getId(), 1, null);
        donationService.cancelDonation(first.getId());

        Donation second = donationService.createDonation(donor.getId(), request.getId(), 2, "second try");

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(second.getStatus()).isEqualTo(DonationStatus.PENDING);
        assertThat(donationRepository.findById(first.getId()).orElseThrow().getStatus()).isEqualTo(DonationStatus.CANCELLED);
    }

    @Test
    void cancellingRequestCancelsOpenDonationsButKeepsCompleted() {
        Donor other = testUserFactory.createDonor("race-other@example.com", BloodType.A_POSITIVE);
        Donation completed = donationService.createDonation(other.getId(), request.getId(), 1, null);
        donationService.updateStatus(completed.getId(), DonationService.UpdateDonationStatusCommand.of("completed"));
        Donation pending = donationService.createDonation(donor.getId(), request.getId(), 1, null);

        requestService.cancelRequest(hospital.getId(), request.getId());

        assertThat(donationRepository.findById(pending.getId()).orElseThrow().getStatus()).isEqualTo(DonationStatus.CANCELLED);
        assertThat(donationRepository.findById(completed.getId()).orElseThrow().getStatus()).isEqualTo(DonationStatus.COMPLETED);
    }
}
