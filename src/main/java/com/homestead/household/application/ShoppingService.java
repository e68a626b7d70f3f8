package com.homestead.household.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.ShoppingCategory;
import com.homestead.household.domain.model.ShoppingItem;
import com.homestead.household.domain.port.out.ShoppingRepository;
import com.homestead.household.domain.port.out.ShoppingRepository.ItemChanges;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Shopping categories and their items.
 * <p>
 * A category is cached with its items embedded, so every item write drops the
 * owning category and the home's category list. Items themselves are read directly.
 */
@Service
public class ShoppingService {

    private static final Logger logger = LoggerFactory.getLogger(ShoppingService.class);

    private static final TypeReference<List<ShoppingCategory>> CATEGORY_LIST = new TypeReference<>() {};

    private final ShoppingRepository shoppingRepository;
    private final CacheAsideTemplate cacheAside;

    public ShoppingService(ShoppingRepository shoppingRepository, CacheAsideTemplate cacheAside) {
        this.shoppingRepository = shoppingRepository;
        this.cacheAside = cacheAside;
    }

    // Categories

    public ShoppingCategory createCategory(long homeId, String name, String icon, String color) {
        String resolvedColor = color == null || color.isBlank() ? ShoppingCategory.DEFAULT_COLOR : color;
        ShoppingCategory draft = new ShoppingCategory(null, homeId, name, icon, resolvedColor, null, List.of());

        return cacheAside.execute(CacheMutation
                .writing(() -> shoppingRepository.createCategory(draft))
                .invalidate(CacheKeys.shoppingCategoriesForHome(homeId))
                .publish(created -> DomainEvent.of(Module.SHOPPING_CATEGORY, Action.CREATED, created))
                .build());
    }

    public List<ShoppingCategory> getCategoriesForHome(long homeId) {
        return cacheAside.readThrough(CacheKeys.shoppingCategoriesForHome(homeId), CATEGORY_LIST,
                () -> shoppingRepository.findCategoriesByHomeId(homeId));
    }

    public ShoppingCategory getCategory(long categoryId, long homeId) {
        ShoppingCategory category = cacheAside.readThrough(CacheKeys.shoppingCategory(categoryId),
                ShoppingCategory.class, () -> findCategory(categoryId));
        if (category.homeId() == null || category.homeId() != homeId) {
            throw new BusinessRuleException("shopping category " + categoryId + " belongs to another home");
        }
        return category;
    }

    public ShoppingCategory updateCategory(long categoryId, String name, String icon, String color) {
        ShoppingCategory category = findCategory(categoryId);

        return cacheAside.execute(CacheMutation
                .writing(() -> shoppingRepository.updateCategory(categoryId, name, icon, color))
                .invalidate(categoryKeys(category))
                .publish(updated -> DomainEvent.of(Module.SHOPPING_CATEGORY, Action.UPDATED, updated))
                .build());
    }

    public void deleteCategory(long categoryId) {
        ShoppingCategory category = findCategory(categoryId);

        cacheAside.execute(CacheMutation
                .running(() -> shoppingRepository.deleteCategory(categoryId))
                .invalidate(categoryKeys(category))
                .publish(ignored -> DomainEvent.deleted(Module.SHOPPING_CATEGORY, categoryId))
                .build());

        logger.info("Deleted shopping category {} with {} items", categoryId, category.items().size());
    }

    // Items

    public ShoppingItem createItem(long categoryId, long uploadedBy, String name, String image, String link) {
        ShoppingCategory category = findCategory(categoryId);
        ShoppingItem draft = new ShoppingItem(null, categoryId, name, uploadedBy, false, image, link, null, null);

        return cacheAside.execute(CacheMutation
                .writing(() -> shoppingRepository.createItem(draft))
                .invalidate(categoryKeys(category))
                .publish(created -> DomainEvent.of(Module.SHOPPING_ITEM, Action.CREATED, created))
                .build());
    }

    public ShoppingItem getItem(long itemId) {
        return findItem(itemId);
    }

    public List<ShoppingItem> getItemsForCategory(long categoryId) {
        return shoppingRepository.findItemsByCategoryId(categoryId);
    }

    public void deleteItem(long itemId) {
        ShoppingItem item = findItem(itemId);
        ShoppingCategory category = findCategory(item.categoryId());

        cacheAside.execute(CacheMutation
                .running(() -> shoppingRepository.deleteItem(itemId))
                .invalidate(categoryKeys(category))
                .publish(ignored -> DomainEvent.deleted(Module.SHOPPING_ITEM, itemId))
                .build());
    }

    public ShoppingItem markBought(long itemId) {
        ShoppingItem item = findItem(itemId);
        ShoppingCategory category = findCategory(item.categoryId());

        return cacheAside.execute(CacheMutation
                .writing(() -> shoppingRepository.markItemBought(itemId))
                .invalidate(categoryKeys(category))
                .publish(bought -> DomainEvent.of(Module.SHOPPING_ITEM, Action.UPDATED, bought))
                .build());
    }

    public ShoppingItem updateItem(long itemId, ItemChanges changes) {
        ShoppingItem item = findItem(itemId);
        ShoppingCategory category = findCategory(item.categoryId());

        return cacheAside.execute(CacheMutation
                .writing(() -> shoppingRepository.updateItem(itemId, changes))
                .invalidate(categoryKeys(category))
                .publish(updated -> DomainEvent.of(Module.SHOPPING_ITEM, Action.UPDATED, updated))
                .build());
    }

    private ShoppingCategory findCategory(long categoryId) {
        return shoppingRepository.findCategoryById(categoryId)
                .orElseThrow(() -> new EntityNotFoundException("shopping category", categoryId));
    }

    private ShoppingItem findItem(long itemId) {
        return shoppingRepository.findItemById(itemId)
                .orElseThrow(() -> new EntityNotFoundException("shopping item", itemId));
    }

    private static List<CacheKey> categoryKeys(ShoppingCategory category) {
        return List.of(CacheKeys.shoppingCategory(category.id()), CacheKeys.shoppingCategoriesForHome(category.homeId()));
    }
}
