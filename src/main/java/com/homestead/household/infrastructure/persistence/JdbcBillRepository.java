package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.exception.InvalidStateTransitionException;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.domain.port.out.BillRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcBillRepository extends JdbcRepositorySupport implements BillRepository {

    private static final String COLUMNS = """
            id, home_id, bill_category_id, type, payed, payment_date, total_amount,
            period_start, period_end, uploaded_by, ocr_data, created_at""";

    private static final RowMapper<Bill> BILL_MAPPER = (rs, rowNum) -> new Bill(
            rs.getLong("id"),
            rs.getLong("home_id"),
            nullableLong(rs, "bill_category_id"),
            rs.getString("type"),
            rs.getBoolean("payed"),
            instant(rs, "payment_date"),
            rs.getBigDecimal("total_amount"),
            localDate(rs, "period_start"),
            localDate(rs, "period_end"),
            nullableLong(rs, "uploaded_by"),
            rs.getString("ocr_data"),
            instant(rs, "created_at")
    );

    public JdbcBillRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public Bill create(Bill bill) {
        String sql = """
            INSERT INTO bills (home_id, bill_category_id, type, total_amount,
                               period_start, period_end, uploaded_by, ocr_data)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING %s
            """.formatted(COLUMNS);

        return execute("creating bill", () -> jdbcTemplate.queryForObject(sql, BILL_MAPPER,
                bill.homeId(), bill.billCategoryId(), bill.type(), bill.totalAmount(),
                sqlDate(bill.periodStart()), sqlDate(bill.periodEnd()), bill.uploadedBy(), bill.ocrData()));
    }

    @Override
    public Optional<Bill> findById(long id) {
        return execute("finding bill " + id, () -> first(jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM bills WHERE id = ?", BILL_MAPPER, id)));
    }

    @Override
    public List<Bill> findByHomeId(long homeId) {
        return execute("finding bills of home " + homeId, () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM bills WHERE home_id = ? ORDER BY created_at DESC, id DESC",
                BILL_MAPPER, homeId));
    }

    @Override
    public List<Bill> findByCategoryId(long categoryId) {
        return execute("finding bills of category " + categoryId, () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM bills WHERE bill_category_id = ? ORDER BY id", BILL_MAPPER, categoryId));
    }

    @Override
    public void delete(long id) {
        int deleted = execute("deleting bill " + id, () -> jdbcTemplate.update("DELETE FROM bills WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("bill", id);
        }
    }

    @Override
    @Transactional
    public Bill markPayed(long id) {
        String sql = """
            UPDATE bills
            SET payed = TRUE, payment_date = now()
            WHERE id = ? AND payed = FALSE
            RETURNING %s
            """.formatted(COLUMNS);

        Optional<Bill> paid = execute("marking bill " + id + " paid", () -> first(jdbcTemplate.query(sql, BILL_MAPPER, id)));
        if (paid.isPresent()) {
            return paid.get();
        }

        findById(id).orElseThrow(() -> new EntityNotFoundException("bill", id));
        throw new InvalidStateTransitionException("bill " + id + " is already paid");
    }
}
