package com.lifelink.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.util.UUID;

import com.lifelink.backend.modules.donation.application.DonationCompletedEvent;
import com.lifelink.backend.modules.donation.application.DonationMatchedEvent;
import com.lifelink.backend.modules.notification.application.DonationNotificationListener;
import com.lifelink.backend.modules.notification.application.NotificationDispatchService;
import com.lifelink.backend.modules.request.application.RequestPublishedEvent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DonationNotificationListenerTest {

    @Mock
    private NotificationDispatchService dispatchService;

    @InjectMocks
    private DonationNotificationListener listener;

    @Test
    void matchDeliveryFailureDoesNotPropagate() {
        DonationMatchedEvent event = new DonationMatchedEvent(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        doThrow(new DataAccessResourceFailureException("db down")).when(dispatchService).dispatchMatch(event);

        assertThatCode(() -> listener.onDonationMatched(event)).doesNotThrowAnyException();
        verify(dispatchService).dispatchMatch(event);
    }

    @Test
    void broadcastFailureDoesNotPropagate() {
        RequestPublishedEvent event = new RequestPublishedEvent(UUID.randomUUID());
        doThrow(new IllegalStateException("boom")).when(dispatchService).dispatchRequestBroadcast(event);

        assertThatCode(() -> listener.onRequestPublished(event)).doesNotThrowAnyException();
    }

    @Test
    void milestoneFailureDoesNotPropagate() {
        DonationCompletedEvent event = new DonationCompletedEvent(UUID.randomUUID(), UUID.randomUUID());
        doThrow(new IllegalStateException("boom")).when(dispatchService).dispatchMilestone(event);

        assertThatCode(() -> listener.onDonationCompleted(event)).doesNotThrowAnyException();
    }
}
