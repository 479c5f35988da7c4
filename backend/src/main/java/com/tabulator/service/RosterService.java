package com.tabulator.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabulator.dto.RosterRequests;
import com.tabulator.dto.RosterResponses;
import com.tabulator.mapper.TabulatorResponseMapper;
import com.tabulator.model.ActivityActionType;
import com.tabulator.model.ActivityActorType;
import com.tabulator.model.Contestant;
import com.tabulator.model.Division;
import com.tabulator.model.Judge;
import com.tabulator.repository.CategoryRepository;
import com.tabulator.repository.ContestantRepository;
import com.tabulator.repository.CriterionRepository;
import com.tabulator.repository.JudgeRepository;
import com.tabulator.web.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class RosterService {

    private static final Logger log = LoggerFactory.getLogger(RosterService.class);
    private static final String ADMIN_ACTOR = "admin";

    private final CategoryRepository categoryRepository;
    private final CriterionRepository criterionRepository;
    private final ContestantRepository contestantRepository;
    private final JudgeRepository judgeRepository;
    private final ActivityLogService activityLogService;
    private final TabulatorResponseMapper tabulatorResponseMapper;

    public RosterService(
            CategoryRepository categoryRepository,
            CriterionRepository criterionRepository,
            ContestantRepository contestantRepository,
            JudgeRepository judgeRepository,
            ActivityLogService activityLogService,
            TabulatorResponseMapper tabulatorResponseMapper
    ) {
        this.categoryRepository = categoryRepository;
        this.criterionRepository = criterionRepository;
        this.contestantRepository = contestantRepository;
        this.judgeRepository = judgeRepository;
        this.activityLogService = activityLogService;
        this.tabulatorResponseMapper = tabulatorResponseMapper;
    }

    @Transactional(readOnly = true)
    public List<RosterResponses.CategorySummary> listCategories() {
        return tabulatorResponseMapper.toCategorySummaries(categoryRepository.findByActiveTrueOrderBySortOrderAsc());
    }

    @Transactional(readOnly = true)
    public List<RosterResponses.CriterionSummary> listCriteria(UUID categoryId) {
        if (!categoryRepository.existsById(categoryId)) {
            throw ScoringException.notFound("Category not found: " + categoryId);
        }
        return tabulatorResponseMapper.toCriterionSummaries(
                criterionRepository.findByCategoryIdOrderBySortOrderAsc(categoryId)
        );
    }

    @Transactional(readOnly = true)
    public List<RosterResponses.ContestantSummary> listContestants(Division division) {
        if (division != null) {
            return tabulatorResponseMapper.toContestantSummaries(
                    contestantRepository.findByDivisionAndActiveTrueOrderByNumberAsc(division)
            );
        }
        List<Contestant> contestants = new ArrayList<>();
        for (Division each : Division.values()) {
            contestants.addAll(contestantRepository.findByDivisionAndActiveTrueOrderByNumberAsc(each));
        }
        return tabulatorResponseMapper.toContestantSummaries(contestants);
    }

    @Transactional(readOnly = true)
    public List<RosterResponses.JudgeSummary> listJudges(Division division) {
        List<Judge> judges = division == null
                ? judgeRepository.findAllByOrderByDivisionAscFullNameAsc()
                : judgeRepository.findByDivisionOrderByFullNameAsc(division);
        return tabulatorResponseMapper.toJudgeSummaries(judges);
    }

    @Transactional
    public RosterResponses.ContestantSummary createContestant(RosterRequests.CreateContestantRequest request) {
        if (contestantRepository.existsByDivisionAndNumber(request.division(), request.number())) {
            throw ScoringException.duplicate(
                    "Contestant number " + request.number() + " is already used in the " + request.division()
                            + " division"
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        Contestant contestant = new Contestant();
        contestant.setContestantId(UUID.randomUUID());
        contestant.setNumber(request.number());
        contestant.setFullName(request.fullName().trim());
        contestant.setDivision(request.division());
        contestant.setActive(true);
        contestant.setCreatedAt(now);
        Contestant saved = contestantRepository.save(contestant);

        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("number", saved.getNumber());
        metadata.put("division", saved.getDivision().name());
        activityLogService.record(
                ActivityActorType.ADMIN,
                ADMIN_ACTOR,
                ActivityActionType.CONTESTANT_CREATED,
                "contestant",
                saved.getContestantId(),
                "Added contestant #" + saved.getNumber() + " " + saved.getFullName(),
                metadata,
                now
        );
        log.info("Contestant created: number={} division={}", saved.getNumber(), saved.getDivision());
        return tabulatorResponseMapper.toContestantSummary(saved);
    }

    @Transactional
    public RosterResponses.JudgeSummary createJudge(RosterRequests.CreateJudgeRequest request) {
        String username = request.username().trim().toLowerCase(Locale.ROOT);
        if (judgeRepository.existsByUsername(username)) {
            throw ScoringException.duplicate("Judge username already exists: " + username);
        }

        OffsetDateTime now = OffsetDateTime.now();
        Judge judge = new Judge();
        judge.setJudgeId(UUID.randomUUID());
        judge.setFullName(request.fullName().trim());
        judge.setUsername(username);
        judge.setDivision(request.division());
        judge.setActive(true);
        judge.setCreatedAt(now);
        Judge saved = judgeRepository.save(judge);

        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("username", saved.getUsername());
        metadata.put("division", saved.getDivision().name());
        activityLogService.record(
                ActivityActorType.ADMIN,
                ADMIN_ACTOR,
                ActivityActionType.JUDGE_CREATED,
                "judge",
                saved.getJudgeId(),
                "Added judge " + saved.getFullName(),
                metadata,
                now
        );
        log.info("Judge created: username={} division={}", saved.getUsername(), saved.getDivision());
        return tabulatorResponseMapper.toJudgeSummary(saved);
    }

    @Transactional
    public RosterResponses.JudgeSummary updateJudge(UUID judgeId, RosterRequests.UpdateJudgeRequest request) {
        if (request.fullName() == null && request.division() == null && request.active() == null) {
            throw ScoringException.invalidRequest("Judge update must change fullName, division or active");
        }
        if (request.fullName() != null && request.fullName().isBlank()) {
            throw ScoringException.invalidRequest("fullName must not be blank");
        }
        Judge judge = judgeRepository.findByJudgeIdForUpdate(judgeId)
                .orElseThrow(() -> ScoringException.notFound("Judge not found: " + judgeId));

        ObjectNode changes = JsonNodeFactory.instance.objectNode();
        if (request.fullName() != null && !request.fullName().trim().equals(judge.getFullName())) {
            judge.setFullName(request.fullName().trim());
            changes.put("fullName", judge.getFullName());
        }
        if (request.division() != null && request.division() != judge.getDivision()) {
            judge.setDivision(request.division());
            changes.put("division", judge.getDivision().name());
        }
        if (request.active() != null && !request.active().equals(judge.getActive())) {
            judge.setActive(request.active());
            changes.put("active", judge.getActive());
        }
        if (changes.isEmpty()) {
            log.debug("Judge update left {} unchanged", judge.getUsername());
            return tabulatorResponseMapper.toJudgeSummary(judge);
        }

        Judge saved = judgeRepository.save(judge);
        activityLogService.record(
                ActivityActorType.ADMIN,
                ADMIN_ACTOR,
                ActivityActionType.JUDGE_UPDATED,
                "judge",
                saved.getJudgeId(),
                describeUpdate(saved, changes),
                changes,
                OffsetDateTime.now()
        );
        log.info("Judge updated: username={} changes={}", saved.getUsername(), changes);
        return tabulatorResponseMapper.toJudgeSummary(saved);
    }

    private static String describeUpdate(Judge judge, ObjectNode changes) {
        if (changes.has("active") && changes.size() == 1) {
            return (Boolean.TRUE.equals(judge.getActive()) ? "Reactivated judge " : "Deactivated judge ")
                    + judge.getFullName();
        }
        return "Updated judge " + judge.getFullName();
    }
}
