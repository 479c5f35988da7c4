package com.tabulator.repository;

import com.tabulator.model.ScoreHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ScoreHistoryRepository extends JpaRepository<ScoreHistory, UUID> {
    List<ScoreHistory> findByJudgeIdOrderByCreatedAtDesc(UUID judgeId);

    List<ScoreHistory> findByContestantIdOrderByCreatedAtDesc(UUID contestantId);

    List<ScoreHistory> findByJudgeIdAndContestantIdOrderByCreatedAtDesc(UUID judgeId, UUID contestantId);

    List<ScoreHistory> findTop200ByOrderByCreatedAtDesc();
}
