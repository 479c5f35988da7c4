package com.tabulator.repository;

import com.tabulator.model.Division;
import com.tabulator.model.Judge;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JudgeRepository extends JpaRepository<Judge, UUID> {
    List<Judge> findByDivisionOrderByFullNameAsc(Division division);

    List<Judge> findByDivisionAndActiveTrueOrderByFullNameAsc(Division division);

    List<Judge> findAllByOrderByDivisionAscFullNameAsc();

    boolean existsByUsername(String username);

    /**
     * Serializes every score write and lock change made on behalf of one judge.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from Judge j where j.judgeId = :judgeId")
    Optional<Judge> findByJudgeIdForUpdate(@Param("judgeId") UUID judgeId);
}
