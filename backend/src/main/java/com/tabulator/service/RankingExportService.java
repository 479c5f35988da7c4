package com.tabulator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tabulator.config.TabulatorProperties;
import com.tabulator.dto.RankingResponses;
import com.tabulator.model.Category;
import com.tabulator.model.Contestant;
import com.tabulator.model.Criterion;
import com.tabulator.model.Division;
import com.tabulator.model.Judge;
import com.tabulator.model.Score;
import com.tabulator.model.SubmissionLock;
import com.tabulator.repository.CategoryRepository;
import com.tabulator.repository.ContestantRepository;
import com.tabulator.repository.CriterionRepository;
import com.tabulator.repository.JudgeRepository;
import com.tabulator.repository.ScoreRepository;
import com.tabulator.repository.SubmissionLockRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Flat, denormalized ranking and score rows for spreadsheet consumers.
 */
@Service
public class RankingExportService {

    private final RankingService rankingService;
    private final JudgeRepository judgeRepository;
    private final ContestantRepository contestantRepository;
    private final CategoryRepository categoryRepository;
    private final CriterionRepository criterionRepository;
    private final ScoreRepository scoreRepository;
    private final SubmissionLockRepository submissionLockRepository;
    private final CsvMapper csvMapper;
    private final char columnSeparator;

    public RankingExportService(
            RankingService rankingService,
            JudgeRepository judgeRepository,
            ContestantRepository contestantRepository,
            CategoryRepository categoryRepository,
            CriterionRepository criterionRepository,
            ScoreRepository scoreRepository,
            SubmissionLockRepository submissionLockRepository,
            TabulatorProperties tabulatorProperties
    ) {
        this.rankingService = rankingService;
        this.judgeRepository = judgeRepository;
        this.contestantRepository = contestantRepository;
        this.categoryRepository = categoryRepository;
        this.criterionRepository = criterionRepository;
        this.scoreRepository = scoreRepository;
        this.submissionLockRepository = submissionLockRepository;

        TabulatorProperties.Export export = tabulatorProperties.getExport();
        CsvMapper.Builder builder = CsvMapper.builder();
        if (export.isQuoteAllValues()) {
            builder.enable(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS);
        }
        this.csvMapper = builder.build();
        this.columnSeparator = export.getColumnSeparator();
    }

    @Transactional(readOnly = true)
    public List<RankingResponses.OverallExportRow> overallRows(Division division) {
        return rankingService.overall(division).rows().stream()
                .map(row -> new RankingResponses.OverallExportRow(
                        division.name(),
                        text(row.contestantNumber()),
                        row.contestantName(),
                        number(row.totalPoints()),
                        String.valueOf(row.categoriesCounted()),
                        number(row.placement()),
                        row.title()
                ))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RankingResponses.CategoryExportRow> categoryRows(Division division) {
        List<RankingResponses.CategoryExportRow> rows = new ArrayList<>();
        for (RankingResponses.CategoryRanking ranking : rankingService.categories(division)) {
            for (RankingResponses.CategoryRankingRow row : ranking.rows()) {
                rows.add(new RankingResponses.CategoryExportRow(
                        division.name(),
                        ranking.categorySlug(),
                        ranking.categoryLabel(),
                        text(row.contestantNumber()),
                        row.contestantName(),
                        number(row.rankSum()),
                        String.valueOf(row.judgeCount()),
                        number(row.placement())
                ));
            }
        }
        return rows;
    }

    @Transactional(readOnly = true)
    public List<RankingResponses.ScoreExportRow> scoreRows(Division division) {
        List<Judge> judges = division == null
                ? judgeRepository.findAllByOrderByDivisionAscFullNameAsc()
                : judgeRepository.findByDivisionOrderByFullNameAsc(division);
        Map<UUID, Contestant> contestants = contestantRepository.findAll().stream()
                .collect(Collectors.toMap(Contestant::getContestantId, Function.identity()));
        Map<UUID, Category> categories = categoryRepository.findAll().stream()
                .collect(Collectors.toMap(Category::getCategoryId, Function.identity()));
        Map<UUID, Criterion> criteria = criterionRepository.findAll().stream()
                .collect(Collectors.toMap(Criterion::getCriterionId, Function.identity()));

        Comparator<Score> scoreOrder = Comparator
                .comparing((Score score) -> contestants.get(score.getContestantId()).getNumber(),
                        Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(score -> categories.get(score.getCategoryId()).getSortOrder())
                .thenComparing(score -> criteria.get(score.getCriterionId()).getSortOrder());

        List<RankingResponses.ScoreExportRow> rows = new ArrayList<>();
        for (Judge judge : judges) {
            Set<String> locked = new HashSet<>();
            for (SubmissionLock lock : submissionLockRepository.findByJudgeId(judge.getJudgeId())) {
                locked.add(lock.getCategoryId() + ":" + lock.getContestantId());
            }
            List<Score> scores = scoreRepository.findByJudgeId(judge.getJudgeId()).stream()
                    .sorted(scoreOrder)
                    .toList();
            for (Score score : scores) {
                Contestant contestant = contestants.get(score.getContestantId());
                rows.add(new RankingResponses.ScoreExportRow(
                        judge.getDivision().name(),
                        judge.getUsername(),
                        text(contestant.getNumber()),
                        contestant.getFullName(),
                        categories.get(score.getCategoryId()).getSlug(),
                        criteria.get(score.getCriterionId()).getSlug(),
                        score.getRawScore().toPlainString(),
                        score.getWeightedScore().toPlainString(),
                        String.valueOf(locked.contains(score.getCategoryId() + ":" + score.getContestantId()))
                ));
            }
        }
        return rows;
    }

    @Transactional(readOnly = true)
    public String overallCsv(Division division) {
        return toCsv(RankingResponses.OverallExportRow.class, overallRows(division));
    }

    @Transactional(readOnly = true)
    public String categoriesCsv(Division division) {
        return toCsv(RankingResponses.CategoryExportRow.class, categoryRows(division));
    }

    @Transactional(readOnly = true)
    public String scoresCsv(Division division) {
        return toCsv(RankingResponses.ScoreExportRow.class, scoreRows(division));
    }

    <T> String toCsv(Class<T> rowType, List<T> rows) {
        CsvSchema schema = csvMapper.schemaFor(rowType)
                .withHeader()
                .withColumnSeparator(columnSeparator);
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render " + rowType.getSimpleName() + " export", ex);
        }
    }

    private static String text(Integer value) {
        return value != null ? value.toString() : null;
    }

    private static String number(BigDecimal value) {
        return value != null ? value.stripTrailingZeros().toPlainString() : null;
    }
}
