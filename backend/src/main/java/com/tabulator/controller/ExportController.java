package com.tabulator.controller;

import com.tabulator.model.Division;
import com.tabulator.service.RankingExportService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

@RestController
@RequestMapping("/api/exports")
public class ExportController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final RankingExportService rankingExportService;

    public ExportController(RankingExportService rankingExportService) {
        this.rankingExportService = rankingExportService;
    }

    @GetMapping("/{division}/overall.csv")
    public ResponseEntity<String> overall(@PathVariable Division division) {
        return csv(fileName(division, "overall"), rankingExportService.overallCsv(division));
    }

    @GetMapping("/{division}/categories.csv")
    public ResponseEntity<String> categories(@PathVariable Division division) {
        return csv(fileName(division, "categories"), rankingExportService.categoriesCsv(division));
    }

    @GetMapping("/scores.csv")
    public ResponseEntity<String> scores(@RequestParam(required = false) Division division) {
        String name = division == null ? "scores.csv" : fileName(division, "scores");
        return csv(name, rankingExportService.scoresCsv(division));
    }

    private static String fileName(Division division, String table) {
        return division.name().toLowerCase(Locale.ROOT) + "-" + table + ".csv";
    }

    private static ResponseEntity<String> csv(String fileName, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(fileName).build().toString())
                .body(body);
    }
}
