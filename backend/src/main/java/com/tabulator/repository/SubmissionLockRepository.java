package com.tabulator.repository;

import com.tabulator.model.SubmissionLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface SubmissionLockRepository extends JpaRepository<SubmissionLock, UUID> {
    boolean existsByJudgeIdAndCategoryIdAndContestantId(UUID judgeId, UUID categoryId, UUID contestantId);

    List<SubmissionLock> findByJudgeIdAndCategoryId(UUID judgeId, UUID categoryId);

    List<SubmissionLock> findByJudgeId(UUID judgeId);

    List<SubmissionLock> findByContestantIdIn(Collection<UUID> contestantIds);

    /**
     * Upsert on the natural key. Returns 1 when a lock row was created, 0 when it already existed.
     */
    @Modifying
    @Query(value = """
            INSERT INTO submission_locks (lock_id, judge_id, category_id, contestant_id, locked_at)
            VALUES (:lockId, :judgeId, :categoryId, :contestantId, now())
            ON CONFLICT (judge_id, category_id, contestant_id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("lockId") UUID lockId,
            @Param("judgeId") UUID judgeId,
            @Param("categoryId") UUID categoryId,
            @Param("contestantId") UUID contestantId
    );

    @Modifying
    @Query("delete from SubmissionLock l where l.judgeId = :judgeId "
            + "and l.categoryId = :categoryId and l.contestantId = :contestantId")
    int deleteByNaturalKey(
            @Param("judgeId") UUID judgeId,
            @Param("categoryId") UUID categoryId,
            @Param("contestantId") UUID contestantId
    );
}
