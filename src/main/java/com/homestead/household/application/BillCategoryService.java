package com.homestead.household.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.domain.model.BillCategory;
import com.homestead.household.domain.port.out.BillCategoryRepository;
import com.homestead.household.domain.port.out.BillRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class BillCategoryService {

    private static final TypeReference<List<BillCategory>> CATEGORY_LIST = new TypeReference<>() {};

    private final BillCategoryRepository categoryRepository;
    private final BillRepository billRepository;
    private final CacheAsideTemplate cacheAside;

    public BillCategoryService(BillCategoryRepository categoryRepository,
                               BillRepository billRepository,
                               CacheAsideTemplate cacheAside) {
        this.categoryRepository = categoryRepository;
        this.billRepository = billRepository;
        this.cacheAside = cacheAside;
    }

    public BillCategory createCategory(long homeId, String name, String color) {
        String resolvedColor = color == null || color.isBlank() ? BillCategory.DEFAULT_COLOR : color;

        return cacheAside.execute(CacheMutation
                .writing(() -> categoryRepository.create(new BillCategory(null, homeId, name, resolvedColor, null)))
                .invalidate(CacheKeys.billCategoriesForHome(homeId))
                .publish(created -> DomainEvent.of(Module.BILL_CATEGORY, Action.CREATED, created))
                .build());
    }

    /**
     * Empty lists are returned but not cached.
     */
    public List<BillCategory> getCategories(long homeId) {
        return cacheAside.readThrough(CacheKeys.billCategoriesForHome(homeId), CATEGORY_LIST,
                () -> categoryRepository.findByHomeId(homeId), categories -> !categories.isEmpty());
    }

    public BillCategory updateCategory(long categoryId, String name, String color) {
        BillCategory category = findCategory(categoryId);

        return cacheAside.execute(CacheMutation
                .writing(() -> categoryRepository.update(categoryId, name, color))
                .invalidate(CacheKeys.billCategoriesForHome(category.homeId()))
                .publish(updated -> DomainEvent.of(Module.BILL_CATEGORY, Action.UPDATED, updated))
                .build());
    }

    /**
     * Deletes the category. Bills pointing to it are kept without a category.
     */
    public void deleteCategory(long categoryId) {
        BillCategory category = findCategory(categoryId);

        List<CacheKey> keys = new ArrayList<>();
        keys.add(CacheKeys.billCategoriesForHome(category.homeId()));
        for (Bill bill : billRepository.findByCategoryId(categoryId)) {
            keys.add(CacheKeys.bill(bill.id()));
        }

        cacheAside.execute(CacheMutation
                .running(() -> categoryRepository.delete(categoryId))
                .invalidate(keys)
                .publish(ignored -> DomainEvent.deleted(Module.BILL_CATEGORY, categoryId))
                .build());
    }

    private BillCategory findCategory(long categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new EntityNotFoundException("bill category", categoryId));
    }
}
