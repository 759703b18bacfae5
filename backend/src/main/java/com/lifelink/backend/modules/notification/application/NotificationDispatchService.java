package com.lifelink.backend.modules.notification.application;

import java.util.List;
import java.util.UUID;

import com.lifelink.backend.modules.donation.application.DonationCompletedEvent;
import com.lifelink.backend.modules.donation.application.DonationMatchedEvent;
import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.domain.DonationStatus;
import com.lifelink.backend.modules.donation.infrastructure.persistence.DonationRepository;
import com.lifelink.backend.modules.matching.application.MatchingService;
import com.lifelink.backend.modules.request.application.RequestPublishedEvent;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.infrastructure.persistence.DonationRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns committed domain events into notifications. Each dispatch runs in its own transaction,
 * separate from the change that raised the event.
 */
@Service
@Transactional(propagation = Propagation.REQUIRES_NEW)
public class NotificationDispatchService {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatchService.class);

    private final NotificationSink notificationSink;
    private final DonationRepository donationRepository;
    private final DonationRequestRepository requestRepository;
    private final MatchingService matchingService;
    private final MilestonePolicy milestonePolicy;

    public NotificationDispatchService(
            NotificationSink notificationSink,
            DonationRepository donationRepository,
            DonationRequestRepository requestRepository,
            MatchingService matchingService,
            MilestonePolicy milestonePolicy
    ) {
        this.notificationSink = notificationSink;
        this.donationRepository = donationRepository;
        this.requestRepository = requestRepository;
        this.matchingService = matchingService;
        this.milestonePolicy = milestonePolicy;
    }

    public void dispatchMatch(DonationMatchedEvent event) {
        Donation donation = donationRepository.findById(event.donationId()).orElse(null);
        if (donation == null) {
            log.warn("Skipping match notification, donation vanished donationId={}", event.donationId());
            return;
        }
        notificationSink.notifyMatch(event.hospitalUserId(), donation, donation.getRequest());
    }

    public void dispatchRequestBroadcast(RequestPublishedEvent event) {
        DonationRequest request = requestRepository.findById(event.requestId()).orElse(null);
        if (request == null) {
            log.warn("Skipping request broadcast, request vanished requestId={}", event.requestId());
            return;
        }
        List<UUID> donorIds = matchingService.findCandidateDonors(request.getId()).stream()
                .map(candidate -> candidate.donor().getId())
                .toList();
        notificationSink.notifyRequestBroadcast(donorIds, request);
        log.info("Request broadcast requestId={} recipients={}", request.getId(), donorIds.size());
    }

    public void dispatchMilestone(DonationCompletedEvent event) {
        long completed = donationRepository.countByDonorIdAndStatus(event.donorId(), DonationStatus.COMPLETED);
        milestonePolicy.achievementFor(completed)
                .ifPresent(achievement -> notificationSink.notifyMilestone(event.donorId(), achievement));
    }
}
