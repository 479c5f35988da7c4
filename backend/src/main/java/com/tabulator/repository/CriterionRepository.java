package com.tabulator.repository;

import com.tabulator.model.Criterion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CriterionRepository extends JpaRepository<Criterion, UUID> {
    List<Criterion> findByCategoryIdOrderBySortOrderAsc(UUID categoryId);

    List<Criterion> findByCategoryIdInOrderBySortOrderAsc(Collection<UUID> categoryIds);
}
