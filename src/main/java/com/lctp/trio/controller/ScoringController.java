package com.lctp.trio.controller;

import com.lctp.trio.entity.CompetitorScore;
import com.lctp.trio.model.ScoreRecord;
import com.lctp.trio.service.ScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class ScoringController {

    private final ScoringService scoringService;

    @PostMapping("/events/{eventId}/scores")
    public ResponseEntity<Map<String, Object>> computeScores(@PathVariable Long eventId,
                                                             @RequestParam(required = false) Long categoryId) {
        log.info("POST /api/v1/events/{}/scores - category={}", eventId, categoryId);
        List<ScoreRecord> records = scoringService.computeScores(eventId, categoryId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("scores", records);
        response.put("count", records.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/events/{eventId}/scores")
    public ResponseEntity<List<CompetitorScore>> eventScores(@PathVariable Long eventId) {
        return ResponseEntity.ok(scoringService.scoresForEvent(eventId));
    }

    @GetMapping("/competitors/{competitorId}/scores")
    public ResponseEntity<List<CompetitorScore>> competitorScores(@PathVariable Long competitorId) {
        return ResponseEntity.ok(scoringService.scoresForCompetitor(competitorId));
    }
}
