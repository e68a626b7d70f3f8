package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Home;
import com.homestead.household.domain.model.HomeMembership;
import com.homestead.household.domain.port.out.HomeRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcHomeRepository extends JdbcRepositorySupport implements HomeRepository {

    // memberships are attached separately
    private static final RowMapper<Home> HOME_MAPPER = (rs, rowNum) -> new Home(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("invite_code"),
            instant(rs, "created_at"),
            List.of()
    );

    private static final String MEMBERSHIP_COLUMNS = "id, home_id, user_id, role, joined_at";

    private static final RowMapper<HomeMembership> MEMBERSHIP_MAPPER = (rs, rowNum) -> new HomeMembership(
            rs.getLong("id"),
            rs.getLong("home_id"),
            rs.getLong("user_id"),
            rs.getString("role"),
            instant(rs, "joined_at")
    );

    public JdbcHomeRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public Home create(String name, String inviteCode) {
        String sql = """
            INSERT INTO homes (name, invite_code)
            VALUES (?, ?)
            RETURNING id, name, invite_code, created_at
            """;

        return execute("creating home", () -> jdbcTemplate.queryForObject(sql, HOME_MAPPER, name, inviteCode));
    }

    /**
     * Both rows are inserted by one statement, so a rejected membership leaves no home behind.
     */
    @Override
    @Transactional
    public Home createWithAdmin(String name, String inviteCode, long adminUserId) {
        String sql = """
            WITH home AS (
                INSERT INTO homes (name, invite_code)
                VALUES (?, ?)
                RETURNING id, name, invite_code, created_at
            ), admin AS (
                INSERT INTO home_memberships (home_id, user_id, role)
                SELECT id, ?, ? FROM home
                RETURNING id
            )
            SELECT home.id, home.name, home.invite_code, home.created_at
            FROM home, admin
            """;

        return execute("creating home with admin " + adminUserId, () -> {
            Home created = jdbcTemplate.queryForObject(sql, HOME_MAPPER,
                    name, inviteCode, adminUserId, HomeMembership.ROLE_ADMIN);
            return new Home(created.id(), created.name(), created.inviteCode(), created.createdAt(),
                    jdbcTemplate.query("SELECT " + MEMBERSHIP_COLUMNS + " FROM home_memberships WHERE home_id = ? ORDER BY id",
                            MEMBERSHIP_MAPPER, created.id()));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Home> findById(long id) {
        return findOne("id = ?", id, "finding home " + id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Home> findByInviteCode(String inviteCode) {
        return findOne("invite_code = ?", inviteCode, "finding home by invite code");
    }

    private Optional<Home> findOne(String condition, Object argument, String operation) {
        return execute(operation, () -> {
            Optional<Home> home = first(jdbcTemplate.query(
                    "SELECT id, name, invite_code, created_at FROM homes WHERE " + condition, HOME_MAPPER, argument));

            return home.map(found -> new Home(found.id(), found.name(), found.inviteCode(), found.createdAt(),
                    jdbcTemplate.query("SELECT " + MEMBERSHIP_COLUMNS + " FROM home_memberships WHERE home_id = ? ORDER BY id",
                            MEMBERSHIP_MAPPER, found.id())));
        });
    }

    @Override
    public boolean inviteCodeExists(String inviteCode) {
        return execute("checking invite code", () -> Boolean.TRUE.equals(jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM homes WHERE invite_code = ?)", Boolean.class, inviteCode)));
    }

    @Override
    public boolean isMember(long homeId, long userId) {
        return execute("checking membership", () -> Boolean.TRUE.equals(jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM home_memberships WHERE home_id = ? AND user_id = ?)",
                Boolean.class, homeId, userId)));
    }

    @Override
    public HomeMembership addMember(long homeId, long userId, String role) {
        String sql = "INSERT INTO home_memberships (home_id, user_id, role) VALUES (?, ?, ?) RETURNING " + MEMBERSHIP_COLUMNS;
        return execute("adding user " + userId + " to home " + homeId,
                () -> jdbcTemplate.queryForObject(sql, MEMBERSHIP_MAPPER, homeId, userId, role));
    }

    @Override
    public void deleteMember(long homeId, long userId) {
        int deleted = execute("removing user " + userId + " from home " + homeId, () -> jdbcTemplate.update(
                "DELETE FROM home_memberships WHERE home_id = ? AND user_id = ?", homeId, userId));
        if (deleted == 0) {
            throw new EntityNotFoundException("membership of user " + userId + " in home", homeId);
        }
    }

    @Override
    public void delete(long id) {
        int deleted = execute("deleting home " + id, () -> jdbcTemplate.update("DELETE FROM homes WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("home", id);
        }
        logger.info("Deleted home {}", id);
    }
}
