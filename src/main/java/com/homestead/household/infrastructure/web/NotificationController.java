package com.homestead.household.infrastructure.web;

import com.homestead.household.application.NotificationService;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.model.HomeNotification;
import com.homestead.household.domain.model.Notification;
import com.homestead.household.infrastructure.web.dto.NotificationRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @PostMapping("/notifications")
    public ResponseEntity<Notification> notifyUser(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                                   @Valid @RequestBody NotificationRequest request) {
        if (request.toUserId() == null) {
            throw new BusinessRuleException("to_user_id is required");
        }
        Notification notification = notificationService.notifyUser(userId, request.toUserId(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(notification);
    }

    @GetMapping("/users/me/notifications")
    public ResponseEntity<List<Notification>> getMyNotifications(@RequestHeader(ApiHeaders.USER_ID) long userId) {
        return ResponseEntity.ok(notificationService.getUserNotifications(userId));
    }

    @PostMapping("/notifications/{notificationId}/read")
    public ResponseEntity<Void> markRead(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                         @PathVariable long notificationId) {
        notificationService.markRead(notificationId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/homes/{homeId}/notifications")
    public ResponseEntity<HomeNotification> notifyHome(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                                       @PathVariable long homeId,
                                                       @Valid @RequestBody NotificationRequest request) {
        HomeNotification notification = notificationService.notifyHome(userId, homeId, request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(notification);
    }

    @GetMapping("/homes/{homeId}/notifications")
    public ResponseEntity<List<HomeNotification>> getHomeNotifications(@PathVariable long homeId) {
        return ResponseEntity.ok(notificationService.getHomeNotifications(homeId));
    }

    @PostMapping("/homes/{homeId}/notifications/{notificationId}/read")
    public ResponseEntity<Void> markHomeNotificationRead(@PathVariable long homeId, @PathVariable long notificationId) {
        notificationService.markHomeNotificationRead(notificationId, homeId);
        return ResponseEntity.noContent().build();
    }
}
