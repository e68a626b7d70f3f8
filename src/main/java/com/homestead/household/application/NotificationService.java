package com.homestead.household.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.model.HomeNotification;
import com.homestead.household.domain.model.Notification;
import com.homestead.household.domain.port.out.NotificationRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * User-addressed notifications and home-wide ones. Each list is cached per recipient.
 * Marking one read is scoped to its recipient, so the invalidated list is always the owner's.
 */
@Service
public class NotificationService {

    private static final TypeReference<List<Notification>> NOTIFICATION_LIST = new TypeReference<>() {};
    private static final TypeReference<List<HomeNotification>> HOME_NOTIFICATION_LIST = new TypeReference<>() {};

    private final NotificationRepository notificationRepository;
    private final CacheAsideTemplate cacheAside;

    public NotificationService(NotificationRepository notificationRepository, CacheAsideTemplate cacheAside) {
        this.notificationRepository = notificationRepository;
        this.cacheAside = cacheAside;
    }

    public Notification notifyUser(Long fromUserId, long toUserId, String description) {
        Notification draft = new Notification(null, fromUserId, toUserId, description, false, null);

        return cacheAside.execute(CacheMutation
                .writing(() -> notificationRepository.create(draft))
                .invalidate(CacheKeys.notificationsForUser(toUserId))
                .publish(created -> DomainEvent.of(Module.NOTIFICATION, Action.CREATED, created))
                .build());
    }

    public List<Notification> getUserNotifications(long userId) {
        return cacheAside.readThrough(CacheKeys.notificationsForUser(userId), NOTIFICATION_LIST,
                () -> notificationRepository.findByUserId(userId));
    }

    public void markRead(long notificationId, long userId) {
        cacheAside.execute(CacheMutation
                .running(() -> notificationRepository.markAsRead(notificationId, userId))
                .invalidate(CacheKeys.notificationsForUser(userId))
                .publish(ignored -> DomainEvent.of(Module.NOTIFICATION, Action.MARK_READ, Map.of("id", notificationId)))
                .build());
    }

    public HomeNotification notifyHome(Long fromUserId, long homeId, String description) {
        HomeNotification draft = new HomeNotification(null, fromUserId, homeId, description, false, null);

        return cacheAside.execute(CacheMutation
                .writing(() -> notificationRepository.createHomeNotification(draft))
                .invalidate(CacheKeys.notificationsForHome(homeId))
                .publish(created -> DomainEvent.of(Module.HOME_NOTIFICATION, Action.CREATED, created))
                .build());
    }

    public List<HomeNotification> getHomeNotifications(long homeId) {
        return cacheAside.readThrough(CacheKeys.notificationsForHome(homeId), HOME_NOTIFICATION_LIST,
                () -> notificationRepository.findByHomeId(homeId));
    }

    public void markHomeNotificationRead(long notificationId, long homeId) {
        cacheAside.execute(CacheMutation
                .running(() -> notificationRepository.markHomeNotificationAsRead(notificationId, homeId))
                .invalidate(CacheKeys.notificationsForHome(homeId))
                .publish(ignored -> DomainEvent.of(Module.HOME_NOTIFICATION, Action.MARK_READ,
                        Map.of("id", notificationId)))
                .build());
    }
}
