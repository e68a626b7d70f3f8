package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CreateBillRequest(
        @NotBlank String type,
        Long billCategoryId,
        @NotNull @PositiveOrZero BigDecimal totalAmount,
        LocalDate periodStart,
        LocalDate periodEnd,
        String ocrData
) {}
