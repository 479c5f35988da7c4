package com.tabulator.controller;

import com.tabulator.dto.RankingResponses;
import com.tabulator.model.Division;
import com.tabulator.service.RankingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/rankings/{division}")
public class RankingController {

    private final RankingService rankingService;

    public RankingController(RankingService rankingService) {
        this.rankingService = rankingService;
    }

    @GetMapping("/overall")
    public ResponseEntity<RankingResponses.OverallRanking> overall(@PathVariable Division division) {
        return ResponseEntity.ok(rankingService.overall(division));
    }

    @GetMapping("/categories")
    public ResponseEntity<List<RankingResponses.CategoryRanking>> categories(@PathVariable Division division) {
        return ResponseEntity.ok(rankingService.categories(division));
    }

    @GetMapping("/categories/{categoryId}")
    public ResponseEntity<RankingResponses.CategoryRanking> category(
            @PathVariable Division division,
            @PathVariable UUID categoryId
    ) {
        return ResponseEntity.ok(rankingService.category(division, categoryId));
    }

    @GetMapping("/judges/{judgeId}/categories/{categoryId}")
    public ResponseEntity<RankingResponses.JudgeCategoryRanking> judgeCategory(
            @PathVariable Division division,
            @PathVariable UUID judgeId,
            @PathVariable UUID categoryId
    ) {
        return ResponseEntity.ok(rankingService.judgeCategory(division, judgeId, categoryId));
    }
}
