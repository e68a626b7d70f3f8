package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.SystemOfRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common plumbing of the JDBC repositories: every {@link DataAccessException} is logged
 * and rethrown as a {@link SystemOfRecordException}.
 */
abstract class JdbcRepositorySupport {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final JdbcTemplate jdbcTemplate;

    protected JdbcRepositorySupport(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    protected <T> T execute(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            logger.error("Database error while {}", operation, e);
            throw new SystemOfRecordException("Failed while " + operation, e);
        }
    }

    protected void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    protected static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    protected static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }

    protected static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date == null ? null : date.toLocalDate();
    }

    protected static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    protected static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    protected static Date sqlDate(LocalDate date) {
        return date == null ? null : Date.valueOf(date);
    }
}
