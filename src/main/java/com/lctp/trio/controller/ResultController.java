package com.lctp.trio.controller;

import com.lctp.trio.entity.RunResult;
import com.lctp.trio.model.dto.RecordRunRequest;
import com.lctp.trio.model.dto.ResultView;
import com.lctp.trio.service.ResultService;
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
public class ResultController {

    private final ResultService resultService;

    @PutMapping("/results/{id}/run")
    public ResponseEntity<Map<String, Object>> recordRun(@PathVariable Long id, @RequestBody RecordRunRequest request) {
        log.info("PUT /api/v1/results/{}/run - attempts={}, noTime={}, disqualified={}, prize={}",
                id, request.attemptTimes(), request.noTime(), request.disqualified(), request.prize());
        RunResult result = resultService.recordRun(id,
                request.attemptTimes(),
                Boolean.TRUE.equals(request.noTime()),
                Boolean.TRUE.equals(request.disqualified()),
                request.prize(),
                request.notes());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("result", ResultView.from(result));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/results/{id}")
    public ResponseEntity<ResultView> get(@PathVariable Long id) {
        return ResponseEntity.ok(ResultView.from(resultService.getResult(id)));
    }

    @PostMapping("/events/{eventId}/placements")
    public ResponseEntity<Map<String, Object>> recomputePlacements(@PathVariable Long eventId,
                                                                   @RequestParam(required = false) Long categoryId) {
        log.info("POST /api/v1/events/{}/placements - category={}", eventId, categoryId);
        List<ResultView> ranked = resultService.recomputePlacements(eventId, categoryId).stream()
                .map(ResultView::from)
                .toList();

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("results", ranked);
        response.put("count", ranked.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/events/{eventId}/results")
    public ResponseEntity<List<ResultView>> list(@PathVariable Long eventId,
                                                 @RequestParam(required = false) Long categoryId) {
        return ResponseEntity.ok(resultService.listResults(eventId, categoryId).stream().map(ResultView::from).toList());
    }
}
