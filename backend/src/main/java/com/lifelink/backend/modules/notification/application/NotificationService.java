package com.lifelink.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.notification.domain.Notification;
import com.lifelink.backend.modules.notification.domain.NotificationKind;
import com.lifelink.backend.modules.notification.domain.NotificationState;
import com.lifelink.backend.modules.notification.domain.RelatedType;
import com.lifelink.backend.modules.notification.infrastructure.persistence.NotificationKindCount;
import com.lifelink.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class NotificationService implements NotificationSink {

    static final String TITLE_MATCH = "New Donor Matched";
    static final String TITLE_REQUEST = "New Donation Request Available";
    static final String TITLE_MILESTONE_PREFIX = "Achievement Unlocked: ";

    private final NotificationRepository notificationRepository;
    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            AppUserRepository appUserRepository,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    @Override
    public void notifyMatch(UUID hospitalUserId, Donation donation, DonationRequest request) {
        Notification notification = new Notification(
                appUserRepository.getReferenceById(hospitalUserId),
                NotificationKind.MATCH,
                TITLE_MATCH,
                "A donor has matched your " + request.describeNeed() + " request"
        );
        notification.relateTo(RelatedType.DONATION, donation.getId().toString());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("donationId", donation.getId().toString());
        metadata.put("requestId", request.getId().toString());
        metadata.put("requestKind", request.getKind().getCode());
        notification.setMetadata(metadata);

        notificationRepository.save(notification);
    }

    @Override
    public void notifyRequestBroadcast(Collection<UUID> donorIds, DonationRequest request) {
        if (donorIds == null || donorIds.isEmpty()) {
            return;
        }
        String body = "A " + request.getUrgency().getCode() + " priority " + request.describeNeed() + " request is available";

        List<Notification> notifications = donorIds.stream()
                .map(donorId -> {
                    Notification notification = new Notification(
                            appUserRepository.getReferenceById(donorId),
                            NotificationKind.REQUEST,
                            TITLE_REQUEST,
                            body
                    );
                    notification.relateTo(RelatedType.REQUEST, request.getId().toString());

                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("requestId", request.getId().toString());
                    metadata.put("requestKind", request.getKind().getCode());
                    metadata.put("urgency", request.getUrgency().getCode());
                    metadata.put("hospitalId", request.getHospital().getId().toString());
                    notification.setMetadata(metadata);
                    return notification;
                })
                .toList();

        notificationRepository.saveAll(notifications);
    }

    @Override
    public void notifyMilestone(UUID userId, Achievement achievement) {
        String body = achievement.message() != null
                ? achievement.message()
                : "Congratulations! You've unlocked: " + achievement.title();
        Notification notification = new Notification(
                appUserRepository.getReferenceById(userId),
                NotificationKind.MILESTONE,
                TITLE_MILESTONE_PREFIX + achievement.title(),
                body
        );
        notification.relateTo(RelatedType.ACHIEVEMENT, achievement.id());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("achievementId", achievement.id());
        metadata.put("achievementType", achievement.type());
        metadata.put("points", achievement.points());
        notification.setMetadata(metadata);

        notificationRepository.save(notification);
    }

    @Transactional(readOnly = true)
    public NotificationPageResult getNotifications(UUID userId, NotificationState state, NotificationKind kind, Pageable pageable) {
        Page<Notification> page = notificationRepository.search(userId, state, kind, pageable);
        long unreadCount = notificationRepository.countByUserIdAndState(userId, NotificationState.UNREAD);
        return new NotificationPageResult(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                unreadCount
        );
    }

    public Notification markNotificationRead(UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> ProblemException.notFound("NOTIFICATION_NOT_FOUND"));
        if (notification.getState() == NotificationState.UNREAD) {
            notification.markRead(OffsetDateTime.now(clock));
        }
        return notification;
    }

    public int markAllNotificationsRead(UUID userId) {
        return notificationRepository.markAllRead(userId, OffsetDateTime.now(clock));
    }

    public void deleteNotification(UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> ProblemException.notFound("NOTIFICATION_NOT_FOUND"));
        notificationRepository.delete(notification);
    }

    public int deleteAllNotifications(UUID userId) {
        return notificationRepository.deleteAllByUserId(userId);
    }

    @Transactional(readOnly = true)
    public NotificationStats getStats(UUID userId) {
        long total = notificationRepository.countByUserId(userId);
        long unread = notificationRepository.countByUserIdAndState(userId, NotificationState.UNREAD);

        Map<NotificationKind, Long> byKind = new EnumMap<>(NotificationKind.class);
        for (NotificationKind kind : NotificationKind.values()) {
            byKind.put(kind, 0L);
        }
        for (NotificationKindCount count : notificationRepository.countByKind(userId)) {
            byKind.put(count.kind(), count.count());
        }
        return new NotificationStats(total, unread, total - unread, byKind);
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }

    public record NotificationStats(long total, long unread, long read, Map<NotificationKind, Long> byKind) {
    }
}
