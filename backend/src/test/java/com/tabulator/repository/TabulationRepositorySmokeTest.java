package com.tabulator.repository;

import com.tabulator.model.Category;
import com.tabulator.model.Contestant;
import com.tabulator.model.Criterion;
import com.tabulator.model.Division;
import com.tabulator.model.Judge;
import com.tabulator.model.Score;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.flyway.enabled=true",
        "spring.flyway.locations=classpath:db/migration"
})
@Testcontainers(disabledWithoutDocker = true)
@Transactional
class TabulationRepositorySmokeTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private CriterionRepository criterionRepository;

    @Autowired
    private JudgeRepository judgeRepository;

    @Autowired
    private ContestantRepository contestantRepository;

    @Autowired
    private ScoreRepository scoreRepository;

    @Autowired
    private SubmissionLockRepository submissionLockRepository;

    @BeforeEach
    void isolateRosterTables() {
        jdbcTemplate.execute("""
                TRUNCATE TABLE
                    activity_log,
                    score_history,
                    submission_locks,
                    scores,
                    contestants,
                    judges
                CASCADE
                """);
    }

    @Test
    void flywayCreatesSchemaAndSeedsCategoryConfiguration() {
        Integer tableCount = jdbcTemplate.queryForObject(
                """
                        SELECT COUNT(*)
                        FROM information_schema.tables
                        WHERE table_schema = 'public'
                          AND table_name IN ('categories', 'criteria', 'judges', 'contestants', 'scores',
                                             'submission_locks', 'score_history', 'activity_log')
                        """,
                Integer.class
        );
        assertEquals(8, tableCount);

        List<Category> categories = categoryRepository.findByActiveTrueOrderBySortOrderAsc();
        assertEquals(
                List.of("production", "runway", "streetwear", "free-speech", "formal", "interview"),
                categories.stream().map(Category::getSlug).toList()
        );
        for (Category category : categories) {
            List<Criterion> criteria = criterionRepository.findByCategoryIdOrderBySortOrderAsc(category.getCategoryId());
            assertEquals(4, criteria.size());
            BigDecimal percentageSum = criteria.stream()
                    .map(Criterion::getPercentage)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, BigDecimal.ONE.compareTo(percentageSum), category.getSlug());
        }
    }

    @Test
    void lockInsertIsIdempotentOnNaturalKey() {
        Judge judge = saveJudge("judge-lock", Division.FEMALE);
        Contestant contestant = saveContestant(1, Division.FEMALE);
        UUID categoryId = categoryRepository.findBySlug("runway").orElseThrow().getCategoryId();

        int first = submissionLockRepository.insertIfAbsent(
                UUID.randomUUID(), judge.getJudgeId(), categoryId, contestant.getContestantId());
        int second = submissionLockRepository.insertIfAbsent(
                UUID.randomUUID(), judge.getJudgeId(), categoryId, contestant.getContestantId());

        assertEquals(1, first);
        assertEquals(0, second);
        assertTrue(submissionLockRepository.existsByJudgeIdAndCategoryIdAndContestantId(
                judge.getJudgeId(), categoryId, contestant.getContestantId()));
        assertEquals(1, submissionLockRepository.findByJudgeId(judge.getJudgeId()).size());

        assertEquals(1, submissionLockRepository.deleteByNaturalKey(
                judge.getJudgeId(), categoryId, contestant.getContestantId()));
        assertFalse(submissionLockRepository.existsByJudgeIdAndCategoryIdAndContestantId(
                judge.getJudgeId(), categoryId, contestant.getContestantId()));
    }

    @Test
    void judgeScoresAreUniquePerCriterion() {
        Judge judge = saveJudge("judge-unique", Division.MALE);
        Contestant contestant = saveContestant(7, Division.MALE);
        Criterion criterion = criterionRepository.findByCategoryIdOrderBySortOrderAsc(
                categoryRepository.findBySlug("interview").orElseThrow().getCategoryId()).get(0);

        scoreRepository.saveAndFlush(score(judge, contestant, criterion, "42.500"));
        assertEquals(1, scoreRepository.findByJudgeIdAndCategoryId(
                judge.getJudgeId(), criterion.getCategoryId()).size());

        assertThrows(DataIntegrityViolationException.class,
                () -> scoreRepository.saveAndFlush(score(judge, contestant, criterion, "40.000")));
    }

    private Judge saveJudge(String username, Division division) {
        Judge judge = new Judge();
        judge.setJudgeId(UUID.randomUUID());
        judge.setFullName("Judge " + username);
        judge.setUsername(username);
        judge.setDivision(division);
        return judgeRepository.saveAndFlush(judge);
    }

    private Contestant saveContestant(int number, Division division) {
        Contestant contestant = new Contestant();
        contestant.setContestantId(UUID.randomUUID());
        contestant.setNumber(number);
        contestant.setFullName("Contestant " + number);
        contestant.setDivision(division);
        return contestantRepository.saveAndFlush(contestant);
    }

    private static Score score(Judge judge, Contestant contestant, Criterion criterion, String raw) {
        Score score = new Score();
        score.setScoreId(UUID.randomUUID());
        score.setJudgeId(judge.getJudgeId());
        score.setContestantId(contestant.getContestantId());
        score.setCategoryId(criterion.getCategoryId());
        score.setCriterionId(criterion.getCriterionId());
        score.setRawScore(new BigDecimal(raw));
        score.setWeightedScore(new BigDecimal(raw));
        score.setCreatedAt(OffsetDateTime.now());
        score.setUpdatedAt(OffsetDateTime.now());
        return score;
    }
}
