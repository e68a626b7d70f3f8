package com.homestead.household.application;

import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.InvalidStateTransitionException;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.domain.port.out.BillRepository;
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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BillServiceTest {

    @Mock
    private BillRepository billRepository;

    private InMemoryCacheStore store;
    private TypedCache cache;
    private RecordingEventPublisher publisher;
    private BillService billService;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        cache = CacheFixtures.typedCache(store);
        publisher = new RecordingEventPublisher();
        billService = new BillService(billRepository, CacheFixtures.cacheAside(cache, publisher));
    }

    @Test
    void shouldInvalidateWriteAndRepopulateWhenMarkingPaid() {
        // Given
        Bill unpaid = bill(false, null);
        Bill paid = bill(true, Instant.parse("2025-02-01T10:00:00Z"));
        cache.set(CacheKeys.bill(42), unpaid);
        when(billRepository.markPayed(42)).thenAnswer(invocation -> {
            assertThat(store.contains("bill:42")).as("bill:42 dropped before the write").isFalse();
            return paid;
        });

        // When
        Bill result = billService.markPaid(42);

        // Then
        assertThat(result.payed()).isTrue();
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.BILL, Action.MARKED_PAYED, paid));
        assertThat(billService.getBill(42).payed()).isTrue();
        verify(billRepository, never()).findById(42);
    }

    @Test
    void shouldRejectPayingTwice() {
        // Given
        cache.set(CacheKeys.bill(42), bill(true, Instant.parse("2025-02-01T10:00:00Z")));
        when(billRepository.markPayed(42)).thenThrow(new InvalidStateTransitionException("bill 42 is already paid"));

        // When & Then
        assertThatThrownBy(() -> billService.markPaid(42))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(publisher.events()).isEmpty();
        assertThat(store.contains("bill:42")).isFalse();
    }

    @Test
    void shouldDropCachedBillOnDelete() {
        // Given
        cache.set(CacheKeys.bill(42), bill(false, null));

        // When
        billService.deleteBill(42);

        // Then
        assertThat(store.contains("bill:42")).isFalse();
        assertThat(publisher.single()).isEqualTo(DomainEvent.deleted(Module.BILL, 42));
        verify(billRepository).delete(42);
    }

    @Test
    void shouldReadHomeBillsDirectly() {
        // Given
        when(billRepository.findByHomeId(7)).thenReturn(List.of(bill(false, null)));

        // When
        billService.getBillsForHome(7);
        billService.getBillsForHome(7);

        // Then
        verify(billRepository, times(2)).findByHomeId(7);
    }

    @Test
    void shouldPublishCreatedBill() {
        // Given
        Bill created = bill(false, null);
        when(billRepository.create(any())).thenReturn(created);

        // When
        billService.createBill(7, 2, "electricity", null, new BigDecimal("120.50"),
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), null);

        // Then
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.BILL, Action.CREATED, created));
    }

    @Test
    void shouldLoadBillOnMiss() {
        when(billRepository.findById(42)).thenReturn(Optional.of(bill(false, null)));

        assertThat(billService.getBill(42).id()).isEqualTo(42L);
        assertThat(store.contains("bill:42")).isTrue();
    }

    private static Bill bill(boolean payed, Instant paymentDate) {
        return new Bill(42L, 7L, null, "electricity", payed, paymentDate, new BigDecimal("120.50"),
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), 2L, null, Instant.parse("2025-01-31T09:00:00Z"));
    }
}
