package com.homestead.household.application;

import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.ShoppingCategory;
import com.homestead.household.domain.model.ShoppingItem;
import com.homestead.household.domain.port.out.ShoppingRepository;
import com.homestead.household.domain.port.out.ShoppingRepository.ItemChanges;
import com.homestead.household.infrastructure.cache.TypedCache;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import com.homestead.household.support.CacheFixtures;
import com.homestead.household.support.InMemoryCacheStore;
import com.homestead.household.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShoppingServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-10T08:00:00Z");

    @Mock
    private ShoppingRepository shoppingRepository;

    private InMemoryCacheStore store;
    private TypedCache cache;
    private RecordingEventPublisher publisher;
    private ShoppingService shoppingService;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        cache = CacheFixtures.typedCache(store);
        publisher = new RecordingEventPublisher();
        shoppingService = new ShoppingService(shoppingRepository, CacheFixtures.cacheAside(cache, publisher));
    }

    @Test
    void shouldRejectCategoryOfAnotherHome() {
        when(shoppingRepository.findCategoryById(5)).thenReturn(Optional.of(category(List.of())));

        assertThatThrownBy(() -> shoppingService.getCategory(5, 8))
                .isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void shouldServeCategoryWithItemsFromCache() {
        // Given
        ShoppingCategory groceries = category(List.of(item(false)));
        when(shoppingRepository.findCategoryById(5)).thenReturn(Optional.of(groceries));

        // When
        shoppingService.getCategory(5, 7);
        ShoppingCategory cached = shoppingService.getCategory(5, 7);

        // Then
        assertThat(cached).isEqualTo(groceries);
        verify(shoppingRepository, times(1)).findCategoryById(5);
    }

    @Test
    void shouldInvalidateOwningCategoryWhenItemIsBought() {
        // Given
        ShoppingItem bought = new ShoppingItem(50L, 5L, "Milk", 2L, true, null, null, NOW, NOW);
        when(shoppingRepository.findItemById(50)).thenReturn(Optional.of(item(false)));
        when(shoppingRepository.findCategoryById(5)).thenReturn(Optional.of(category(List.of(item(false)))));
        when(shoppingRepository.markItemBought(50)).thenReturn(bought);
        cache.set(CacheKeys.shoppingCategory(5), category(List.of(item(false))));
        store.put("home:7:shopping-categories", "[]");

        // When
        shoppingService.markBought(50);

        // Then
        assertThat(store.contains("shopping-category:5")).isFalse();
        assertThat(store.contains("home:7:shopping-categories")).isFalse();
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.SHOPPING_ITEM, Action.UPDATED, bought));
    }

    @Test
    void shouldPassPartialChangesThrough() {
        // Given
        ItemChanges changes = new ItemChanges("Oat milk", null, null, null, null);
        ShoppingItem renamed = new ShoppingItem(50L, 5L, "Oat milk", 2L, false, null, null, null, NOW);
        when(shoppingRepository.findItemById(50)).thenReturn(Optional.of(item(false)));
        when(shoppingRepository.findCategoryById(5)).thenReturn(Optional.of(category(List.of())));
        when(shoppingRepository.updateItem(50, changes)).thenReturn(renamed);

        // When
        ShoppingItem result = shoppingService.updateItem(50, changes);

        // Then
        assertThat(result.name()).isEqualTo("Oat milk");
        assertThat(publisher.single().module()).isEqualTo(Module.SHOPPING_ITEM);
    }

    @Test
    void shouldFailBeforeInvalidatingWhenItemIsUnknown() {
        // Given
        when(shoppingRepository.findItemById(99)).thenReturn(Optional.empty());
        store.put("home:7:shopping-categories", "[]");

        // When & Then
        assertThatThrownBy(() -> shoppingService.deleteItem(99))
                .isInstanceOf(EntityNotFoundException.class);
        assertThat(store.contains("home:7:shopping-categories")).isTrue();
        verify(shoppingRepository, never()).deleteItem(anyLong());
    }

    @Test
    void shouldDeleteCategory() {
        // Given
        when(shoppingRepository.findCategoryById(5)).thenReturn(Optional.of(category(List.of(item(false)))));

        // When
        shoppingService.deleteCategory(5);

        // Then
        verify(shoppingRepository).deleteCategory(5);
        assertThat(publisher.single()).isEqualTo(DomainEvent.deleted(Module.SHOPPING_CATEGORY, 5));
    }

    private static ShoppingCategory category(List<ShoppingItem> items) {
        return new ShoppingCategory(5L, 7L, "Groceries", "cart", ShoppingCategory.DEFAULT_COLOR, NOW, items);
    }

    private static ShoppingItem item(boolean bought) {
        return new ShoppingItem(50L, 5L, "Milk", 2L, bought, null, null, null, NOW);
    }
}
