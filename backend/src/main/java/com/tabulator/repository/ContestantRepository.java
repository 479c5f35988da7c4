package com.tabulator.repository;

import com.tabulator.model.Contestant;
import com.tabulator.model.Division;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContestantRepository extends JpaRepository<Contestant, UUID> {
    List<Contestant> findByDivisionAndActiveTrueOrderByNumberAsc(Division division);

    boolean existsByDivisionAndNumber(Division division, Integer number);
}
