package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.exception.InvalidStateTransitionException;
import com.homestead.household.domain.model.AssignmentStatus;
import com.homestead.household.domain.model.Task;
import com.homestead.household.domain.model.TaskAssignment;
import com.homestead.household.domain.port.out.TaskRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcTaskRepository extends JdbcRepositorySupport implements TaskRepository {

    private static final String TASK_COLUMNS = "id, home_id, room_id, name, description, schedule_type, created_at";
    private static final String ASSIGNMENT_COLUMNS = "id, task_id, home_id, user_id, status, assigned_date, completed_at";

    private static final RowMapper<Task> TASK_MAPPER = (rs, rowNum) -> new Task(
            rs.getLong("id"),
            rs.getLong("home_id"),
            nullableLong(rs, "room_id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("schedule_type"),
            instant(rs, "created_at")
    );

    private static final RowMapper<TaskAssignment> ASSIGNMENT_MAPPER = (rs, rowNum) -> new TaskAssignment(
            rs.getLong("id"),
            rs.getLong("task_id"),
            rs.getLong("home_id"),
            rs.getLong("user_id"),
            AssignmentStatus.valueOf(rs.getString("status")),
            localDate(rs, "assigned_date"),
            instant(rs, "completed_at")
    );

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public Task create(Task task) {
        String sql = """
            INSERT INTO tasks (home_id, room_id, name, description, schedule_type)
            VALUES (?, ?, ?, ?, ?)
            RETURNING %s
            """.formatted(TASK_COLUMNS);

        return execute("creating task", () -> jdbcTemplate.queryForObject(sql, TASK_MAPPER,
                task.homeId(), task.roomId(), task.name(), task.description(), task.scheduleType()));
    }

    @Override
    public Optional<Task> findById(long id) {
        return execute("finding task " + id, () -> first(jdbcTemplate.query(
                "SELECT " + TASK_COLUMNS + " FROM tasks WHERE id = ?", TASK_MAPPER, id)));
    }

    @Override
    public List<Task> findByHomeId(long homeId) {
        return execute("finding tasks of home " + homeId, () -> jdbcTemplate.query(
                "SELECT " + TASK_COLUMNS + " FROM tasks WHERE home_id = ? ORDER BY id", TASK_MAPPER, homeId));
    }

    @Override
    public List<Task> findByRoomId(long roomId) {
        return execute("finding tasks of room " + roomId, () -> jdbcTemplate.query(
                "SELECT " + TASK_COLUMNS + " FROM tasks WHERE room_id = ? ORDER BY id", TASK_MAPPER, roomId));
    }

    @Override
    public Task reassignRoom(long taskId, Long roomId) {
        String sql = "UPDATE tasks SET room_id = ? WHERE id = ? RETURNING " + TASK_COLUMNS;
        return execute("moving task " + taskId, () -> first(jdbcTemplate.query(sql, TASK_MAPPER, roomId, taskId)))
                .orElseThrow(() -> new EntityNotFoundException("task", taskId));
    }

    @Override
    public void delete(long id) {
        int deleted = execute("deleting task " + id, () -> jdbcTemplate.update("DELETE FROM tasks WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("task", id);
        }
    }

    @Override
    public TaskAssignment assignUser(long taskId, long userId, LocalDate date) {
        // home_id is copied from the task so per-home queries need no join
        String sql = """
            INSERT INTO task_assignments (task_id, home_id, user_id, status, assigned_date)
            SELECT t.id, t.home_id, ?, 'ASSIGNED', ?
            FROM tasks t
            WHERE t.id = ?
            RETURNING %s
            """.formatted(ASSIGNMENT_COLUMNS);

        return execute("assigning task " + taskId, () -> first(jdbcTemplate.query(sql, ASSIGNMENT_MAPPER,
                userId, sqlDate(date), taskId)))
                .orElseThrow(() -> new EntityNotFoundException("task", taskId));
    }

    @Override
    public Optional<TaskAssignment> findAssignmentById(long assignmentId) {
        return execute("finding assignment " + assignmentId, () -> first(jdbcTemplate.query(
                "SELECT " + ASSIGNMENT_COLUMNS + " FROM task_assignments WHERE id = ?", ASSIGNMENT_MAPPER, assignmentId)));
    }

    @Override
    public List<TaskAssignment> findAssignmentsByTaskId(long taskId) {
        return execute("finding assignments of task " + taskId, () -> jdbcTemplate.query(
                "SELECT " + ASSIGNMENT_COLUMNS + " FROM task_assignments WHERE task_id = ? ORDER BY assigned_date, id",
                ASSIGNMENT_MAPPER, taskId));
    }

    @Override
    public List<TaskAssignment> findAssignmentsForUser(long userId) {
        return execute("finding assignments of user " + userId, () -> jdbcTemplate.query(
                "SELECT " + ASSIGNMENT_COLUMNS + " FROM task_assignments WHERE user_id = ? ORDER BY assigned_date, id",
                ASSIGNMENT_MAPPER, userId));
    }

    @Override
    public Optional<TaskAssignment> findClosestAssignmentForUser(long userId) {
        String sql = """
            SELECT %s
            FROM task_assignments
            WHERE user_id = ? AND status = 'ASSIGNED'
            ORDER BY assigned_date, id
            LIMIT 1
            """.formatted(ASSIGNMENT_COLUMNS);

        return execute("finding closest assignment of user " + userId,
                () -> first(jdbcTemplate.query(sql, ASSIGNMENT_MAPPER, userId)));
    }

    @Override
    @Transactional
    public TaskAssignment markCompleted(long assignmentId) {
        String sql = """
            UPDATE task_assignments
            SET status = 'COMPLETED', completed_at = now()
            WHERE id = ? AND status = 'ASSIGNED'
            RETURNING %s
            """.formatted(ASSIGNMENT_COLUMNS);

        return transition(sql, assignmentId, "already completed");
    }

    @Override
    @Transactional
    public TaskAssignment markUncompleted(long assignmentId) {
        String sql = """
            UPDATE task_assignments
            SET status = 'ASSIGNED', completed_at = NULL
            WHERE id = ? AND status = 'COMPLETED'
            RETURNING %s
            """.formatted(ASSIGNMENT_COLUMNS);

        return transition(sql, assignmentId, "not completed");
    }

    private TaskAssignment transition(String sql, long assignmentId, String rejection) {
        Optional<TaskAssignment> updated = execute("updating assignment " + assignmentId,
                () -> first(jdbcTemplate.query(sql, ASSIGNMENT_MAPPER, assignmentId)));
        if (updated.isPresent()) {
            return updated.get();
        }

        findAssignmentById(assignmentId).orElseThrow(() -> new EntityNotFoundException("assignment", assignmentId));
        throw new InvalidStateTransitionException("assignment " + assignmentId + " is " + rejection);
    }

    @Override
    public void deleteAssignment(long assignmentId) {
        int deleted = execute("deleting assignment " + assignmentId, () -> jdbcTemplate.update(
                "DELETE FROM task_assignments WHERE id = ?", assignmentId));
        if (deleted == 0) {
            throw new EntityNotFoundException("assignment", assignmentId);
        }
    }
}
