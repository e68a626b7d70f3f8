package com.homestead.household.domain.model;

public record Vote(
        Long id,
        Long userId,
        Long optionId
) {}
