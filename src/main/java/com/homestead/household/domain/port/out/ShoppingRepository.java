package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.ShoppingCategory;
import com.homestead.household.domain.model.ShoppingItem;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for shopping categories and their items.
 * Categories are returned with their items loaded.
 */
public interface ShoppingRepository {

    ShoppingCategory createCategory(ShoppingCategory category);

    Optional<ShoppingCategory> findCategoryById(long id);

    List<ShoppingCategory> findCategoriesByHomeId(long homeId);

    /**
     * Partial update; {@code null} arguments keep the current value.
     */
    ShoppingCategory updateCategory(long id, String name, String icon, String color);

    void deleteCategory(long id);

    ShoppingItem createItem(ShoppingItem item);

    Optional<ShoppingItem> findItemById(long id);

    List<ShoppingItem> findItemsByCategoryId(long categoryId);

    ShoppingItem markItemBought(long id);

    ShoppingItem updateItem(long id, ItemChanges changes);

    void deleteItem(long id);

    /**
     * Partial item update. A {@code null} field keeps the current value.
     * Setting {@code bought} stamps or clears the bought date unless {@code boughtDate} is given.
     */
    record ItemChanges(String name, String image, String link, Boolean bought, Instant boughtDate) {}
}
