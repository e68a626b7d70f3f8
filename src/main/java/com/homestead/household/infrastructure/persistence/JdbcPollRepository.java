package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.exception.PollClosedException;
import com.homestead.household.domain.model.Poll;
import com.homestead.household.domain.model.PollOption;
import com.homestead.household.domain.model.PollStatus;
import com.homestead.household.domain.model.Vote;
import com.homestead.household.domain.port.out.PollRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Polls are stored over three tables and assembled here: poll row, its options, the votes per option.
 */
@Repository
public class JdbcPollRepository extends JdbcRepositorySupport implements PollRepository {

    private static final String POLL_COLUMNS = "id, home_id, question, type, status, allow_revote, ends_at, created_at";

    private static final RowMapper<Poll> POLL_MAPPER = (rs, rowNum) -> new Poll(
            rs.getLong("id"),
            rs.getLong("home_id"),
            rs.getString("question"),
            rs.getString("type"),
            PollStatus.valueOf(rs.getString("status")),
            rs.getBoolean("allow_revote"),
            instant(rs, "ends_at"),
            instant(rs, "created_at"),
            List.of()
    );

    private static final RowMapper<Vote> VOTE_MAPPER = (rs, rowNum) -> new Vote(
            rs.getLong("id"),
            rs.getLong("user_id"),
            rs.getLong("option_id")
    );

    public JdbcPollRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    @Transactional
    public Poll create(Poll poll, List<String> optionTitles) {
        String sql = """
            INSERT INTO polls (home_id, question, type, status, allow_revote, ends_at)
            VALUES (?, ?, ?, 'OPEN', ?, ?)
            RETURNING %s
            """.formatted(POLL_COLUMNS);

        return execute("creating poll", () -> {
            Poll created = jdbcTemplate.queryForObject(sql, POLL_MAPPER,
                    poll.homeId(), poll.question(), poll.type(), poll.allowRevote(), timestamp(poll.endsAt()));

            List<Object[]> options = optionTitles.stream()
                    .map(title -> new Object[] {created.id(), title})
                    .toList();
            jdbcTemplate.batchUpdate("INSERT INTO poll_options (poll_id, title) VALUES (?, ?)", options);

            return withOptions(created);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Poll> findById(long id) {
        return execute("finding poll " + id, () -> first(jdbcTemplate.query(
                "SELECT " + POLL_COLUMNS + " FROM polls WHERE id = ?", POLL_MAPPER, id))
                .map(this::withOptions));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Poll> findByOptionId(long optionId) {
        String sql = """
            SELECT p.id, p.home_id, p.question, p.type, p.status, p.allow_revote, p.ends_at, p.created_at
            FROM polls p
            JOIN poll_options o ON o.poll_id = p.id
            WHERE o.id = ?
            """;

        return execute("finding poll of option " + optionId, () -> first(jdbcTemplate.query(sql, POLL_MAPPER, optionId))
                .map(this::withOptions));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Poll> findByHomeId(long homeId) {
        return execute("finding polls of home " + homeId, () -> jdbcTemplate.query(
                        "SELECT " + POLL_COLUMNS + " FROM polls WHERE home_id = ? ORDER BY created_at DESC, id DESC",
                        POLL_MAPPER, homeId)
                .stream()
                .map(this::withOptions)
                .toList());
    }

    @Override
    @Transactional
    public Poll close(long id) {
        int updated = execute("closing poll " + id, () -> jdbcTemplate.update(
                "UPDATE polls SET status = 'CLOSED' WHERE id = ? AND status = 'OPEN'", id));
        if (updated == 0) {
            findById(id).orElseThrow(() -> new EntityNotFoundException("poll", id));
            throw new PollClosedException(id);
        }
        return findById(id).orElseThrow(() -> new EntityNotFoundException("poll", id));
    }

    @Override
    public void delete(long id) {
        int deleted = execute("deleting poll " + id, () -> jdbcTemplate.update("DELETE FROM polls WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("poll", id);
        }
    }

    /**
     * Voting twice for the same option returns the existing vote.
     */
    @Override
    @Transactional
    public Vote vote(long userId, long optionId) {
        String statusSql = """
            SELECT p.id, p.status
            FROM polls p
            JOIN poll_options o ON o.poll_id = p.id
            WHERE o.id = ?
            FOR UPDATE OF p
            """;
        String voteSql = """
            INSERT INTO votes (option_id, user_id)
            VALUES (?, ?)
            ON CONFLICT (option_id, user_id) DO UPDATE SET user_id = EXCLUDED.user_id
            RETURNING id, user_id, option_id
            """;

        return execute("voting for option " + optionId, () -> {
            List<Map<String, Object>> polls = jdbcTemplate.queryForList(statusSql, optionId);
            if (polls.isEmpty()) {
                throw new EntityNotFoundException("poll option", optionId);
            }
            Map<String, Object> poll = polls.get(0);
            if (PollStatus.CLOSED.name().equals(poll.get("status"))) {
                throw new PollClosedException(((Number) poll.get("id")).longValue());
            }
            return jdbcTemplate.queryForObject(voteSql, VOTE_MAPPER, optionId, userId);
        });
    }

    @Override
    public int unvote(long userId, long pollId) {
        String sql = """
            DELETE FROM votes
            WHERE user_id = ?
              AND option_id IN (SELECT id FROM poll_options WHERE poll_id = ?)
            """;

        int removed = execute("removing votes of user " + userId + " on poll " + pollId,
                () -> jdbcTemplate.update(sql, userId, pollId));
        logger.debug("Removed {} votes of user {} on poll {}", removed, userId, pollId);
        return removed;
    }

    private Poll withOptions(Poll poll) {
        Map<Long, List<Vote>> votesByOption = jdbcTemplate.query("""
                        SELECT v.id, v.user_id, v.option_id
                        FROM votes v
                        JOIN poll_options o ON o.id = v.option_id
                        WHERE o.poll_id = ?
                        ORDER BY v.id
                        """, VOTE_MAPPER, poll.id())
                .stream()
                .collect(Collectors.groupingBy(Vote::optionId, LinkedHashMap::new, Collectors.toList()));

        List<PollOption> options = new ArrayList<>();
        jdbcTemplate.query("SELECT id, poll_id, title FROM poll_options WHERE poll_id = ? ORDER BY id",
                (RowCallbackHandler) rs -> {
                    long optionId = rs.getLong("id");
                    options.add(new PollOption(optionId, rs.getLong("poll_id"), rs.getString("title"),
                            votesByOption.getOrDefault(optionId, List.of())));
                }, poll.id());

        return new Poll(poll.id(), poll.homeId(), poll.question(), poll.type(), poll.status(),
                poll.allowRevote(), poll.endsAt(), poll.createdAt(), options);
    }
}
