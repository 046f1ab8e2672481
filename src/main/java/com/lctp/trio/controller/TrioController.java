package com.lctp.trio.controller;

import com.lctp.trio.entity.Trio;
import com.lctp.trio.model.DrawResult;
import com.lctp.trio.model.EligibilityResult;
import com.lctp.trio.model.dto.CreateTrioRequest;
import com.lctp.trio.model.dto.DrawRequest;
import com.lctp.trio.model.dto.TrioView;
import com.lctp.trio.model.dto.ValidateTrioRequest;
import com.lctp.trio.service.TrioDrawService;
import com.lctp.trio.service.TrioService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/trios")
public class TrioController {

    private final TrioService trioService;
    private final TrioDrawService trioDrawService;

    /**
     * Check a composition without saving it.
     */
    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody ValidateTrioRequest request) {
        log.info("POST /api/v1/trios/validate - category={}, competitors={}",
                request.categoryId(), request.competitorIds());
        EligibilityResult result = trioService.validateTrio(request.categoryId(), request.competitorIds());

        Map<String, Object> response = new HashMap<>();
        response.put("valid", result.valid());
        response.put("reason", result.reason());
        return ResponseEntity.ok(response);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateTrioRequest request) {
        log.info("POST /api/v1/trios - event={}, category={}, competitors={}",
                request.provaId(), request.categoryId(), request.competitorIds());
        Trio trio = trioService.createTrio(
                request.provaId(), request.categoryId(), request.competitorIds(), request.trioNumber());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("trio", TrioView.from(trio));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/draw")
    public ResponseEntity<Map<String, Object>> draw(@RequestBody DrawRequest request) {
        log.info("POST /api/v1/trios/draw - event={}, category={}, pool={}",
                request.provaId(), request.categoryId(), request.competitorIds());
        DrawResult result = trioDrawService.draw(request.provaId(), request.categoryId(), request.competitorIds());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("mode", result.mode());
        response.put("trios", result.trios().stream().map(TrioView::from).toList());
        response.put("totalTrios", result.totalTrios());
        response.put("drawnCompetitorIds", result.drawnCompetitorIds());
        response.put("notDrawnCompetitorIds", result.notDrawnCompetitorIds());
        response.put("ineligibleCompetitorIds", result.ineligibleCompetitorIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<TrioView>> list(@RequestParam Long provaId, @RequestParam Long categoryId) {
        return ResponseEntity.ok(trioService.listTrios(provaId, categoryId).stream().map(TrioView::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<TrioView> get(@PathVariable Long id) {
        return ResponseEntity.ok(TrioView.from(trioService.getTrio(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        log.info("DELETE /api/v1/trios/{}", id);
        trioService.deleteTrio(id);
        return ResponseEntity.noContent().build();
    }
}
