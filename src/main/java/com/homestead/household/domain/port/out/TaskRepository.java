package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.Task;
import com.homestead.household.domain.model.TaskAssignment;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for tasks and task assignments.
 * Write methods return the row as persisted.
 */
public interface TaskRepository {

    Task create(Task task);

    Optional<Task> findById(long id);

    List<Task> findByHomeId(long homeId);

    List<Task> findByRoomId(long roomId);

    Task reassignRoom(long taskId, Long roomId);

    void delete(long id);

    TaskAssignment assignUser(long taskId, long userId, LocalDate date);

    Optional<TaskAssignment> findAssignmentById(long assignmentId);

    List<TaskAssignment> findAssignmentsByTaskId(long taskId);

    List<TaskAssignment> findAssignmentsForUser(long userId);

    /**
     * Earliest assignment of the user that is not completed yet.
     */
    Optional<TaskAssignment> findClosestAssignmentForUser(long userId);

    /**
     * @throws com.homestead.household.domain.exception.InvalidStateTransitionException if already completed
     */
    TaskAssignment markCompleted(long assignmentId);

    /**
     * @throws com.homestead.household.domain.exception.InvalidStateTransitionException if not completed
     */
    TaskAssignment markUncompleted(long assignmentId);

    void deleteAssignment(long assignmentId);
}
