package com.homestead.household.infrastructure.web.dto;

import com.homestead.household.domain.port.out.ShoppingRepository.ItemChanges;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record ShoppingItemRequest(
        @Size(max = 255) String name,
        String image,
        String link,
        Boolean bought,
        Instant boughtDate
) {
    public ItemChanges toChanges() {
        return new ItemChanges(name, image, link, bought, boughtDate);
    }
}
