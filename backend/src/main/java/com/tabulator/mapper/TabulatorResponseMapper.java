package com.tabulator.mapper;

import com.tabulator.dto.ActivityResponses;
import com.tabulator.dto.RosterResponses;
import com.tabulator.dto.ScoringResponses;
import com.tabulator.model.ActivityLog;
import com.tabulator.model.Category;
import com.tabulator.model.Contestant;
import com.tabulator.model.Criterion;
import com.tabulator.model.Judge;
import com.tabulator.model.Score;
import com.tabulator.model.ScoreHistory;
import com.tabulator.model.SubmissionLock;
import com.tabulator.ranking.WeightedScoreCalculator;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class TabulatorResponseMapper {

    private final WeightedScoreCalculator weightedScoreCalculator;

    public TabulatorResponseMapper(WeightedScoreCalculator weightedScoreCalculator) {
        this.weightedScoreCalculator = weightedScoreCalculator;
    }

    public RosterResponses.CategorySummary toCategorySummary(Category category) {
        return new RosterResponses.CategorySummary(
                category.getCategoryId(),
                category.getSlug(),
                category.getLabel(),
                category.getWeight(),
                category.getSortOrder()
        );
    }

    public List<RosterResponses.CategorySummary> toCategorySummaries(Collection<Category> categories) {
        return categories.stream()
                .map(this::toCategorySummary)
                .toList();
    }

    public RosterResponses.CriterionSummary toCriterionSummary(Criterion criterion) {
        return new RosterResponses.CriterionSummary(
                criterion.getCriterionId(),
                criterion.getCategoryId(),
                criterion.getSlug(),
                criterion.getLabel(),
                criterion.getPercentage(),
                weightedScoreCalculator.maxRawScore(criterion.getPercentage()),
                criterion.getSortOrder()
        );
    }

    public List<RosterResponses.CriterionSummary> toCriterionSummaries(Collection<Criterion> criteria) {
        return criteria.stream()
                .map(this::toCriterionSummary)
                .toList();
    }

    public RosterResponses.ContestantSummary toContestantSummary(Contestant contestant) {
        return new RosterResponses.ContestantSummary(
                contestant.getContestantId(),
                contestant.getNumber(),
                contestant.getFullName(),
                contestant.getDivision() != null ? contestant.getDivision().name() : null,
                Boolean.TRUE.equals(contestant.getActive()),
                contestant.getCreatedAt()
        );
    }

    public List<RosterResponses.ContestantSummary> toContestantSummaries(Collection<Contestant> contestants) {
        return contestants.stream()
                .map(this::toContestantSummary)
                .toList();
    }

    public RosterResponses.JudgeSummary toJudgeSummary(Judge judge) {
        return new RosterResponses.JudgeSummary(
                judge.getJudgeId(),
                judge.getFullName(),
                judge.getUsername(),
                judge.getDivision() != null ? judge.getDivision().name() : null,
                Boolean.TRUE.equals(judge.getActive()),
                judge.getCreatedAt()
        );
    }

    public List<RosterResponses.JudgeSummary> toJudgeSummaries(Collection<Judge> judges) {
        return judges.stream()
                .map(this::toJudgeSummary)
                .toList();
    }

    public ScoringResponses.ScoreRow toScoreRow(Score score) {
        return new ScoringResponses.ScoreRow(
                score.getScoreId(),
                score.getJudgeId(),
                score.getContestantId(),
                score.getCategoryId(),
                score.getCriterionId(),
                score.getRawScore(),
                score.getWeightedScore(),
                score.getUpdatedAt()
        );
    }

    public List<ScoringResponses.ScoreRow> toScoreRows(Collection<Score> scores) {
        return scores.stream()
                .map(this::toScoreRow)
                .toList();
    }

    public ScoringResponses.LockSummary toLockSummary(SubmissionLock lock) {
        return new ScoringResponses.LockSummary(
                lock.getLockId(),
                lock.getJudgeId(),
                lock.getCategoryId(),
                lock.getContestantId(),
                lock.getLockedAt()
        );
    }

    public List<ScoringResponses.LockSummary> toLockSummaries(Collection<SubmissionLock> locks) {
        return locks.stream()
                .map(this::toLockSummary)
                .toList();
    }

    public ScoringResponses.ScoreHistoryEntry toScoreHistoryEntry(ScoreHistory history) {
        return new ScoringResponses.ScoreHistoryEntry(
                history.getHistoryId(),
                history.getScoreId(),
                history.getJudgeId(),
                history.getContestantId(),
                history.getCategoryId(),
                history.getCriterionId(),
                history.getOldRawScore(),
                history.getNewRawScore(),
                history.getOldWeightedScore(),
                history.getNewWeightedScore(),
                history.getChangeType() != null ? history.getChangeType().name() : null,
                history.getCreatedAt()
        );
    }

    public List<ScoringResponses.ScoreHistoryEntry> toScoreHistoryEntries(Collection<ScoreHistory> history) {
        return history.stream()
                .map(this::toScoreHistoryEntry)
                .toList();
    }

    public ActivityResponses.ActivityEntry toActivityEntry(ActivityLog activity) {
        return new ActivityResponses.ActivityEntry(
                activity.getActivityId(),
                activity.getActorType() != null ? activity.getActorType().name() : null,
                activity.getActorName(),
                activity.getActionType() != null ? activity.getActionType().name() : null,
                activity.getEntityType(),
                activity.getEntityId(),
                activity.getDescription(),
                activity.getMetadata(),
                activity.getCreatedAt()
        );
    }

    public List<ActivityResponses.ActivityEntry> toActivityEntries(Collection<ActivityLog> activities) {
        return activities.stream()
                .map(this::toActivityEntry)
                .toList();
    }
}
