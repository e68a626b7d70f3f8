package com.homestead.household.infrastructure.web;

import com.homestead.household.application.ShoppingService;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.model.ShoppingCategory;
import com.homestead.household.domain.model.ShoppingItem;
import com.homestead.household.infrastructure.web.dto.ShoppingCategoryRequest;
import com.homestead.household.infrastructure.web.dto.ShoppingItemRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ShoppingController {

    private final ShoppingService shoppingService;

    public ShoppingController(ShoppingService shoppingService) {
        this.shoppingService = shoppingService;
    }

    @PostMapping("/homes/{homeId}/shopping-categories")
    public ResponseEntity<ShoppingCategory> createCategory(@PathVariable long homeId,
                                                           @Valid @RequestBody ShoppingCategoryRequest request) {
        requireName(request.name());
        ShoppingCategory category = shoppingService.createCategory(homeId, request.name(), request.icon(), request.color());
        return ResponseEntity.status(HttpStatus.CREATED).body(category);
    }

    @GetMapping("/homes/{homeId}/shopping-categories")
    public ResponseEntity<List<ShoppingCategory>> getCategories(@PathVariable long homeId) {
        return ResponseEntity.ok(shoppingService.getCategoriesForHome(homeId));
    }

    @GetMapping("/homes/{homeId}/shopping-categories/{categoryId}")
    public ResponseEntity<ShoppingCategory> getCategory(@PathVariable long homeId, @PathVariable long categoryId) {
        return ResponseEntity.ok(shoppingService.getCategory(categoryId, homeId));
    }

    @PatchMapping("/shopping-categories/{categoryId}")
    public ResponseEntity<ShoppingCategory> updateCategory(@PathVariable long categoryId,
                                                           @Valid @RequestBody ShoppingCategoryRequest request) {
        return ResponseEntity.ok(shoppingService.updateCategory(categoryId, request.name(), request.icon(), request.color()));
    }

    @DeleteMapping("/shopping-categories/{categoryId}")
    public ResponseEntity<Void> deleteCategory(@PathVariable long categoryId) {
        shoppingService.deleteCategory(categoryId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/shopping-categories/{categoryId}/items")
    public ResponseEntity<ShoppingItem> createItem(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                                   @PathVariable long categoryId,
                                                   @Valid @RequestBody ShoppingItemRequest request) {
        requireName(request.name());
        ShoppingItem item = shoppingService.createItem(categoryId, userId, request.name(), request.image(), request.link());
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @GetMapping("/shopping-categories/{categoryId}/items")
    public ResponseEntity<List<ShoppingItem>> getItems(@PathVariable long categoryId) {
        return ResponseEntity.ok(shoppingService.getItemsForCategory(categoryId));
    }

    @GetMapping("/shopping-items/{itemId}")
    public ResponseEntity<ShoppingItem> getItem(@PathVariable long itemId) {
        return ResponseEntity.ok(shoppingService.getItem(itemId));
    }

    @PatchMapping("/shopping-items/{itemId}")
    public ResponseEntity<ShoppingItem> updateItem(@PathVariable long itemId,
                                                   @Valid @RequestBody ShoppingItemRequest request) {
        return ResponseEntity.ok(shoppingService.updateItem(itemId, request.toChanges()));
    }

    @PostMapping("/shopping-items/{itemId}/bought")
    public ResponseEntity<ShoppingItem> markBought(@PathVariable long itemId) {
        return ResponseEntity.ok(shoppingService.markBought(itemId));
    }

    @DeleteMapping("/shopping-items/{itemId}")
    public ResponseEntity<Void> deleteItem(@PathVariable long itemId) {
        shoppingService.deleteItem(itemId);
        return ResponseEntity.noContent().build();
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessRuleException("name is required");
        }
    }
}
