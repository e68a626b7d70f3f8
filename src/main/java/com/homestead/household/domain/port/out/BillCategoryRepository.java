package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.BillCategory;
import java.util.List;
import java.util.Optional;

public interface BillCategoryRepository {

    BillCategory create(BillCategory category);

    Optional<BillCategory> findById(long id);

    List<BillCategory> findByHomeId(long homeId);

    /**
     * Partial update; {@code null} arguments keep the current value.
     */
    BillCategory update(long id, String name, String color);

    void delete(long id);
}
