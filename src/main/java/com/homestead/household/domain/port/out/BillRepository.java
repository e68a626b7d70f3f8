package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.Bill;
import java.util.List;
import java.util.Optional;

public interface BillRepository {

    Bill create(Bill bill);

    Optional<Bill> findById(long id);

    List<Bill> findByHomeId(long homeId);

    List<Bill> findByCategoryId(long categoryId);

    void delete(long id);

    /**
     * Sets the bill paid and stamps the payment date.
     *
     * @throws com.homestead.household.domain.exception.InvalidStateTransitionException if already paid
     */
    Bill markPayed(long id);
}
