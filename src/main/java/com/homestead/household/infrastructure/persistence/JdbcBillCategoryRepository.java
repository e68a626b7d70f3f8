package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.BillCategory;
import com.homestead.household.domain.port.out.BillCategoryRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcBillCategoryRepository extends JdbcRepositorySupport implements BillCategoryRepository {

    private static final String COLUMNS = "id, home_id, name, color, created_at";

    private static final RowMapper<BillCategory> CATEGORY_MAPPER = (rs, rowNum) -> new BillCategory(
            rs.getLong("id"),
            rs.getLong("home_id"),
            rs.getString("name"),
            rs.getString("color"),
            instant(rs, "created_at")
    );

    public JdbcBillCategoryRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public BillCategory create(BillCategory category) {
        return execute("creating bill category", () -> jdbcTemplate.queryForObject(
                "INSERT INTO bill_categories (home_id, name, color) VALUES (?, ?, ?) RETURNING " + COLUMNS,
                CATEGORY_MAPPER, category.homeId(), category.name(), category.color()));
    }

    @Override
    public Optional<BillCategory> findById(long id) {
        return execute("finding bill category " + id, () -> first(jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM bill_categories WHERE id = ?", CATEGORY_MAPPER, id)));
    }

    @Override
    public List<BillCategory> findByHomeId(long homeId) {
        return execute("finding bill categories of home " + homeId, () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM bill_categories WHERE home_id = ? ORDER BY id", CATEGORY_MAPPER, homeId));
    }

    @Override
    public BillCategory update(long id, String name, String color) {
        String sql = """
            UPDATE bill_categories
            SET name = COALESCE(?, name), color = COALESCE(?, color)
            WHERE id = ?
            RETURNING %s
            """.formatted(COLUMNS);

        return execute("updating bill category " + id, () -> first(jdbcTemplate.query(sql, CATEGORY_MAPPER, name, color, id)))
                .orElseThrow(() -> new EntityNotFoundException("bill category", id));
    }

    @Override
    public void delete(long id) {
        int deleted = execute("deleting bill category " + id, () -> jdbcTemplate.update(
                "DELETE FROM bill_categories WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("bill category", id);
        }
    }
}
