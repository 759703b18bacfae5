package com.lifelink.backend.modules.notification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.lifelink.backend.modules.notification.domain.Notification;
import com.lifelink.backend.modules.notification.domain.NotificationKind;
import com.lifelink.backend.modules.notification.domain.NotificationState;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByIdAndUserId(UUID id, UUID userId);

    long countByUserId(UUID userId);

    long countByUserIdAndState(UUID userId, NotificationState state);

    @Query("""
            select n
              from Notification n
             where n.user.id = :userId
               and (:state is null or n.state = :state)
               and (:kind is null or n.kind = :kind)
             order by n.createdAt desc
            """)
    Page<Notification> search(
            @Param("userId") UUID userId,
            @Param("state") NotificationState state,
            @Param("kind") NotificationKind kind,
            Pageable pageable
    );

    @Query("""
            select new com.lifelink.backend.modules.notification.infrastructure.persistence.NotificationKindCount(n.kind, count(n))
              from Notification n
             where n.user.id = :userId
             group by n.kind
            """)
    List<NotificationKindCount> countByKind(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Notification n
               set n.state = com.lifelink.backend.modules.notification.domain.NotificationState.READ,
                   n.readAt = :now,
                   n.updatedAt = :now
             where n.user.id = :userId
               and n.state = com.lifelink.backend.modules.notification.domain.NotificationState.UNREAD
            """)
    int markAllRead(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Notification n where n.user.id = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);
}
