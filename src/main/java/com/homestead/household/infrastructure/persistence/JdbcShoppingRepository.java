package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.ShoppingCategory;
import com.homestead.household.domain.model.ShoppingItem;
import com.homestead.household.domain.port.out.ShoppingRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcShoppingRepository extends JdbcRepositorySupport implements ShoppingRepository {

    private static final String CATEGORY_COLUMNS = "id, home_id, name, icon, color, created_at";
    private static final String ITEM_COLUMNS = "id, category_id, name, uploaded_by, is_bought, image, link, bought_date, created_at";

    // items are attached separately
    private static final RowMapper<ShoppingCategory> CATEGORY_MAPPER = (rs, rowNum) -> new ShoppingCategory(
            rs.getLong("id"),
            rs.getLong("home_id"),
            rs.getString("name"),
            rs.getString("icon"),
            rs.getString("color"),
            instant(rs, "created_at"),
            List.of()
    );

    private static final RowMapper<ShoppingItem> ITEM_MAPPER = (rs, rowNum) -> new ShoppingItem(
            rs.getLong("id"),
            rs.getLong("category_id"),
            rs.getString("name"),
            nullableLong(rs, "uploaded_by"),
            rs.getBoolean("is_bought"),
            rs.getString("image"),
            rs.getString("link"),
            instant(rs, "bought_date"),
            instant(rs, "created_at")
    );

    public JdbcShoppingRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public ShoppingCategory createCategory(ShoppingCategory category) {
        String sql = "INSERT INTO shopping_categories (home_id, name, icon, color) VALUES (?, ?, ?, ?) RETURNING "
                + CATEGORY_COLUMNS;

        return execute("creating shopping category", () -> jdbcTemplate.queryForObject(sql, CATEGORY_MAPPER,
                category.homeId(), category.name(), category.icon(), category.color()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ShoppingCategory> findCategoryById(long id) {
        return execute("finding shopping category " + id, () -> first(jdbcTemplate.query(
                "SELECT " + CATEGORY_COLUMNS + " FROM shopping_categories WHERE id = ?", CATEGORY_MAPPER, id))
                .map(this::withItems));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ShoppingCategory> findCategoriesByHomeId(long homeId) {
        return execute("finding shopping categories of home " + homeId, () -> jdbcTemplate.query(
                        "SELECT " + CATEGORY_COLUMNS + " FROM shopping_categories WHERE home_id = ? ORDER BY id",
                        CATEGORY_MAPPER, homeId)
                .stream()
                .map(this::withItems)
                .toList());
    }

    @Override
    @Transactional
    public ShoppingCategory updateCategory(long id, String name, String icon, String color) {
        String sql = """
            UPDATE shopping_categories
            SET name = COALESCE(?, name), icon = COALESCE(?, icon), color = COALESCE(?, color)
            WHERE id = ?
            RETURNING %s
            """.formatted(CATEGORY_COLUMNS);

        return execute("updating shopping category " + id, () -> first(jdbcTemplate.query(sql, CATEGORY_MAPPER,
                name, icon, color, id)).map(this::withItems))
                .orElseThrow(() -> new EntityNotFoundException("shopping category", id));
    }

    @Override
    public void deleteCategory(long id) {
        int deleted = execute("deleting shopping category " + id, () -> jdbcTemplate.update(
                "DELETE FROM shopping_categories WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("shopping category", id);
        }
    }

    @Override
    public ShoppingItem createItem(ShoppingItem item) {
        String sql = """
            INSERT INTO shopping_items (category_id, name, uploaded_by, image, link)
            VALUES (?, ?, ?, ?, ?)
            RETURNING %s
            """.formatted(ITEM_COLUMNS);

        return execute("creating shopping item", () -> jdbcTemplate.queryForObject(sql, ITEM_MAPPER,
                item.categoryId(), item.name(), item.uploadedBy(), item.image(), item.link()));
    }

    @Override
    public Optional<ShoppingItem> findItemById(long id) {
        return execute("finding shopping item " + id, () -> first(jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM shopping_items WHERE id = ?", ITEM_MAPPER, id)));
    }

    @Override
    public List<ShoppingItem> findItemsByCategoryId(long categoryId) {
        return execute("finding items of shopping category " + categoryId, () -> jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM shopping_items WHERE category_id = ? ORDER BY id",
                ITEM_MAPPER, categoryId));
    }

    @Override
    public ShoppingItem markItemBought(long id) {
        String sql = """
            UPDATE shopping_items
            SET is_bought = TRUE, bought_date = COALESCE(bought_date, now())
            WHERE id = ?
            RETURNING %s
            """.formatted(ITEM_COLUMNS);

        return execute("marking shopping item " + id + " bought", () -> first(jdbcTemplate.query(sql, ITEM_MAPPER, id)))
                .orElseThrow(() -> new EntityNotFoundException("shopping item", id));
    }

    @Override
    @Transactional
    public ShoppingItem updateItem(long id, ItemChanges changes) {
        ShoppingItem current = findItemById(id).orElseThrow(() -> new EntityNotFoundException("shopping item", id));

        boolean bought = changes.bought() != null ? changes.bought() : current.bought();
        Instant boughtDate = changes.boughtDate();
        if (boughtDate == null) {
            if (changes.bought() == null) {
                boughtDate = current.boughtDate();
            } else if (bought) {
                boughtDate = current.boughtDate() != null ? current.boughtDate() : Instant.now();
            }
        }

        String sql = """
            UPDATE shopping_items
            SET name = ?, image = ?, link = ?, is_bought = ?, bought_date = ?
            WHERE id = ?
            RETURNING %s
            """.formatted(ITEM_COLUMNS);

        Object[] args = {
                changes.name() != null ? changes.name() : current.name(),
                changes.image() != null ? changes.image() : current.image(),
                changes.link() != null ? changes.link() : current.link(),
                bought,
                timestamp(boughtDate),
                id
        };
        return execute("updating shopping item " + id, () -> jdbcTemplate.queryForObject(sql, ITEM_MAPPER, args));
    }

    @Override
    public void deleteItem(long id) {
        int deleted = execute("deleting shopping item " + id, () -> jdbcTemplate.update(
                "DELETE FROM shopping_items WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("shopping item", id);
        }
    }

    private ShoppingCategory withItems(ShoppingCategory category) {
        List<ShoppingItem> items = jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM shopping_items WHERE category_id = ? ORDER BY id",
                ITEM_MAPPER, category.id());
        return new ShoppingCategory(category.id(), category.homeId(), category.name(), category.icon(),
                category.color(), category.createdAt(), items);
    }
}
