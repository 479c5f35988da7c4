package com.tabulator.repository;

import com.tabulator.model.Score;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScoreRepository extends JpaRepository<Score, UUID> {
    Optional<Score> findByJudgeIdAndContestantIdAndCriterionId(UUID judgeId, UUID contestantId, UUID criterionId);

    List<Score> findByJudgeIdAndContestantIdAndCategoryId(UUID judgeId, UUID contestantId, UUID categoryId);

    List<Score> findByJudgeIdAndCategoryId(UUID judgeId, UUID categoryId);

    List<Score> findByJudgeId(UUID judgeId);

    List<Score> findByContestantIdIn(Collection<UUID> contestantIds);
}
