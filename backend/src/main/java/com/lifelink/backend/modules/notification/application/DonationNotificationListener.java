package com.lifelink.backend.modules.notification.application;

import com.lifelink.backend.modules.donation.application.DonationCompletedEvent;
import com.lifelink.backend.modules.donation.application.DonationMatchedEvent;
import com.lifelink.backend.modules.request.application.RequestPublishedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers notifications once the triggering change has committed. A delivery failure is
 * reported and dropped; it never affects the committed change.
 */
@Component
public class DonationNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(DonationNotificationListener.class);

    private final NotificationDispatchService dispatchService;

    public DonationNotificationListener(NotificationDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDonationMatched(DonationMatchedEvent event) {
        try {
            dispatchService.dispatchMatch(event);
        } catch (RuntimeException ex) {
            log.warn("[ALERT] Match notification failed donationId={} requestId={}", event.donationId(), event.requestId(), ex);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRequestPublished(RequestPublishedEvent event) {
        try {
            dispatchService.dispatchRequestBroadcast(event);
        } catch (RuntimeException ex) {
            log.warn("[ALERT] Request broadcast failed requestId={}", event.requestId(), ex);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDonationCompleted(DonationCompletedEvent event) {
        try {
            dispatchService.dispatchMilestone(event);
        } catch (RuntimeException ex) {
            log.warn("[ALERT] Milestone notification failed donationId={} donorId={}", event.donationId(), event.donorId(), ex);
        }
    }
}
