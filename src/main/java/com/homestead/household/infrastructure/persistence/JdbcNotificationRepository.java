package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.HomeNotification;
import com.homestead.household.domain.model.Notification;
import com.homestead.household.domain.port.out.NotificationRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JdbcNotificationRepository extends JdbcRepositorySupport implements NotificationRepository {

    private static final RowMapper<Notification> NOTIFICATION_MAPPER = (rs, rowNum) -> new Notification(
            rs.getLong("id"),
            nullableLong(rs, "from_user_id"),
            rs.getLong("to_user_id"),
            rs.getString("description"),
            rs.getBoolean("is_read"),
            instant(rs, "created_at")
    );

    private static final RowMapper<HomeNotification> HOME_NOTIFICATION_MAPPER = (rs, rowNum) -> new HomeNotification(
            rs.getLong("id"),
            nullableLong(rs, "from_user_id"),
            rs.getLong("home_id"),
            rs.getString("description"),
            rs.getBoolean("is_read"),
            instant(rs, "created_at")
    );

    public JdbcNotificationRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public Notification create(Notification notification) {
        String sql = """
            INSERT INTO notifications (from_user_id, to_user_id, description)
            VALUES (?, ?, ?)
            RETURNING id, from_user_id, to_user_id, description, is_read, created_at
            """;

        return execute("creating notification", () -> jdbcTemplate.queryForObject(sql, NOTIFICATION_MAPPER,
                notification.fromUserId(), notification.toUserId(), notification.description()));
    }

    @Override
    public List<Notification> findByUserId(long userId) {
        String sql = """
            SELECT id, from_user_id, to_user_id, description, is_read, created_at
            FROM notifications
            WHERE to_user_id = ?
            ORDER BY created_at DESC, id DESC
            """;

        return execute("finding notifications of user " + userId,
                () -> jdbcTemplate.query(sql, NOTIFICATION_MAPPER, userId));
    }

    @Override
    public void markAsRead(long notificationId, long userId) {
        int updated = execute("marking notification " + notificationId + " read", () -> jdbcTemplate.update(
                "UPDATE notifications SET is_read = TRUE WHERE id = ? AND to_user_id = ?", notificationId, userId));
        if (updated == 0) {
            throw new EntityNotFoundException("notification", notificationId);
        }
    }

    @Override
    public HomeNotification createHomeNotification(HomeNotification notification) {
        String sql = """
            INSERT INTO home_notifications (from_user_id, home_id, description)
            VALUES (?, ?, ?)
            RETURNING id, from_user_id, home_id, description, is_read, created_at
            """;

        return execute("creating home notification", () -> jdbcTemplate.queryForObject(sql, HOME_NOTIFICATION_MAPPER,
                notification.fromUserId(), notification.homeId(), notification.description()));
    }

    @Override
    public List<HomeNotification> findByHomeId(long homeId) {
        String sql = """
            SELECT id, from_user_id, home_id, description, is_read, created_at
            FROM home_notifications
            WHERE home_id = ?
            ORDER BY created_at DESC, id DESC
            """;

        return execute("finding notifications of home " + homeId,
                () -> jdbcTemplate.query(sql, HOME_NOTIFICATION_MAPPER, homeId));
    }

    @Override
    public void markHomeNotificationAsRead(long notificationId, long homeId) {
        int updated = execute("marking home notification " + notificationId + " read", () -> jdbcTemplate.update(
                "UPDATE home_notifications SET is_read = TRUE WHERE id = ? AND home_id = ?", notificationId, homeId));
        if (updated == 0) {
            throw new EntityNotFoundException("home notification", notificationId);
        }
    }
}
