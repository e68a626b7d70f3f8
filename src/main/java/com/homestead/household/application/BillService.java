package com.homestead.household.application;

import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.domain.port.out.BillRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Service
public class BillService {

    private static final Logger logger = LoggerFactory.getLogger(BillService.class);

    private final BillRepository billRepository;
    private final CacheAsideTemplate cacheAside;

    public BillService(BillRepository billRepository, CacheAsideTemplate cacheAside) {
        this.billRepository = billRepository;
        this.cacheAside = cacheAside;
    }

    public Bill createBill(long homeId, long uploadedBy, String type, Long billCategoryId, BigDecimal totalAmount,
                           LocalDate periodStart, LocalDate periodEnd, String ocrData) {
        Bill draft = new Bill(null, homeId, billCategoryId, type, false, null, totalAmount,
                periodStart, periodEnd, uploadedBy, ocrData, null);

        Bill bill = cacheAside.execute(CacheMutation
                .writing(() -> billRepository.create(draft))
                .publish(created -> DomainEvent.of(Module.BILL, Action.CREATED, created))
                .build());

        logger.info("Created bill {} for home {}", bill.id(), homeId);
        return bill;
    }

    public Bill getBill(long billId) {
        return cacheAside.readThrough(CacheKeys.bill(billId), Bill.class, () -> findBill(billId));
    }

    public List<Bill> getBillsForHome(long homeId) {
        return billRepository.findByHomeId(homeId);
    }

    public void deleteBill(long billId) {
        cacheAside.execute(CacheMutation
                .running(() -> billRepository.delete(billId))
                .invalidate(CacheKeys.bill(billId))
                .publish(ignored -> DomainEvent.deleted(Module.BILL, billId))
                .build());
    }

    /**
     * Unpaid to paid. The fresh bill is written back so the next read is a hit.
     */
    public Bill markPaid(long billId) {
        Bill bill = cacheAside.execute(CacheMutation
                .writing(() -> billRepository.markPayed(billId))
                .invalidate(CacheKeys.bill(billId))
                .publish(paid -> DomainEvent.of(Module.BILL, Action.MARKED_PAYED, paid))
                .repopulate(CacheKeys.bill(billId))
                .build());

        logger.info("Bill {} marked as paid", billId);
        return bill;
    }

    private Bill findBill(long billId) {
        return billRepository.findById(billId)
                .orElseThrow(() -> new EntityNotFoundException("bill", billId));
    }
}
