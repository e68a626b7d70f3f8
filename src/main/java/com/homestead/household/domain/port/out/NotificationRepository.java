package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.HomeNotification;
import com.homestead.household.domain.model.Notification;
import java.util.List;

/**
 * Repository port for user-addressed and home-wide notifications.
 */
public interface NotificationRepository {

    Notification create(Notification notification);

    List<Notification> findByUserId(long userId);

    /**
     * Marks a notification addressed to the user as read.
     *
     * @throws com.homestead.household.domain.exception.EntityNotFoundException if the user has no such notification
     */
    void markAsRead(long notificationId, long userId);

    HomeNotification createHomeNotification(HomeNotification notification);

    List<HomeNotification> findByHomeId(long homeId);

    /**
     * @throws com.homestead.household.domain.exception.EntityNotFoundException if the home has no such notification
     */
    void markHomeNotificationAsRead(long notificationId, long homeId);
}
