package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.User;
import com.homestead.household.domain.port.out.UserRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcUserRepository extends JdbcRepositorySupport implements UserRepository {

    private static final String COLUMNS = "id, email, name, avatar, created_at";

    private static final RowMapper<User> USER_MAPPER = (rs, rowNum) -> new User(
            rs.getLong("id"),
            rs.getString("email"),
            rs.getString("name"),
            rs.getString("avatar"),
            instant(rs, "created_at")
    );

    public JdbcUserRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public Optional<User> findById(long id) {
        return execute("finding user " + id, () -> first(jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM users WHERE id = ?", USER_MAPPER, id)));
    }

    @Override
    public User updateName(long id, String name) {
        return update(id, "name", name);
    }

    @Override
    public User updateAvatar(long id, String avatar) {
        return update(id, "avatar", avatar);
    }

    private User update(long id, String column, String value) {
        String sql = "UPDATE users SET " + column + " = ? WHERE id = ? RETURNING " + COLUMNS;
        return execute("updating " + column + " of user " + id, () -> first(jdbcTemplate.query(sql, USER_MAPPER, value, id)))
                .orElseThrow(() -> new EntityNotFoundException("user", id));
    }
}
