package com.homestead.household.infrastructure.web;

import com.homestead.household.application.BillCategoryService;
import com.homestead.household.application.BillService;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.domain.model.BillCategory;
import com.homestead.household.infrastructure.web.dto.BillCategoryRequest;
import com.homestead.household.infrastructure.web.dto.CreateBillRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class BillController {

    private static final Logger logger = LoggerFactory.getLogger(BillController.class);

    private final BillService billService;
    private final BillCategoryService categoryService;

    public BillController(BillService billService, BillCategoryService categoryService) {
        this.billService = billService;
        this.categoryService = categoryService;
    }

    @PostMapping("/homes/{homeId}/bills")
    public ResponseEntity<Bill> createBill(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                           @PathVariable long homeId,
                                           @Valid @RequestBody CreateBillRequest request) {
        if (request.periodStart() != null && request.periodEnd() != null
                && request.periodStart().isAfter(request.periodEnd())) {
            logger.warn("Invalid bill period: start {} is after end {}", request.periodStart(), request.periodEnd());
            throw new BusinessRuleException("period_start must not be after period_end");
        }

        Bill bill = billService.createBill(homeId, userId, request.type(), request.billCategoryId(),
                request.totalAmount(), request.periodStart(), request.periodEnd(), request.ocrData());
        return ResponseEntity.status(HttpStatus.CREATED).body(bill);
    }

    @GetMapping("/homes/{homeId}/bills")
    public ResponseEntity<List<Bill>> getBillsForHome(@PathVariable long homeId) {
        return ResponseEntity.ok(billService.getBillsForHome(homeId));
    }

    @GetMapping("/bills/{billId}")
    public ResponseEntity<Bill> getBill(@PathVariable long billId) {
        return ResponseEntity.ok(billService.getBill(billId));
    }

    @PostMapping("/bills/{billId}/pay")
    public ResponseEntity<Bill> markPaid(@PathVariable long billId) {
        return ResponseEntity.ok(billService.markPaid(billId));
    }

    @DeleteMapping("/bills/{billId}")
    public ResponseEntity<Void> deleteBill(@PathVariable long billId) {
        billService.deleteBill(billId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/homes/{homeId}/bill-categories")
    public ResponseEntity<BillCategory> createCategory(@PathVariable long homeId,
                                                       @Valid @RequestBody BillCategoryRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new BusinessRuleException("name is required");
        }
        BillCategory category = categoryService.createCategory(homeId, request.name(), request.color());
        return ResponseEntity.status(HttpStatus.CREATED).body(category);
    }

    @GetMapping("/homes/{homeId}/bill-categories")
    public ResponseEntity<List<BillCategory>> getCategories(@PathVariable long homeId) {
        return ResponseEntity.ok(categoryService.getCategories(homeId));
    }

    @PatchMapping("/bill-categories/{categoryId}")
    public ResponseEntity<BillCategory> updateCategory(@PathVariable long categoryId,
                                                       @Valid @RequestBody BillCategoryRequest request) {
        return ResponseEntity.ok(categoryService.updateCategory(categoryId, request.name(), request.color()));
    }

    @DeleteMapping("/bill-categories/{categoryId}")
    public ResponseEntity<Void> deleteCategory(@PathVariable long categoryId) {
        categoryService.deleteCategory(categoryId);
        return ResponseEntity.noContent().build();
    }
}
