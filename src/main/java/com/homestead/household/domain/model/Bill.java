package com.homestead.household.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A household bill. Once {@code payed} is set it never goes back.
 */
public record Bill(
        Long id,
        Long homeId,
        Long billCategoryId,
        String type,
        boolean payed,
        Instant paymentDate,
        BigDecimal totalAmount,
        LocalDate periodStart,
        LocalDate periodEnd,
        Long uploadedBy,
        String ocrData,
        Instant createdAt
) {}
