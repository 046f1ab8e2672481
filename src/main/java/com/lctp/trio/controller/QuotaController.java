package com.lctp.trio.controller;

import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.model.dto.BlockQuotaRequest;
import com.lctp.trio.model.dto.CreateQuotaRequest;
import com.lctp.trio.model.dto.QuotaView;
import com.lctp.trio.model.dto.UpdateQuotaRequest;
import com.lctp.trio.service.ParticipationQuotaTracker;
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
@RequestMapping("/api/v1/quotas")
public class QuotaController {

    private final ParticipationQuotaTracker quotaTracker;

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateQuotaRequest request) {
        log.info("POST /api/v1/quotas - competitor={}, event={}, category={}, maxRuns={}",
                request.competitorId(), request.provaId(), request.categoryId(), request.maxRuns());
        ParticipationQuota quota = quotaTracker.create(
                request.competitorId(), request.provaId(), request.categoryId(), request.maxRuns());
        return ResponseEntity.status(HttpStatus.CREATED).body(success(quota));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable Long id, @RequestBody UpdateQuotaRequest request) {
        log.info("PUT /api/v1/quotas/{} - maxRuns={}, runsExecuted={}", id, request.maxRuns(), request.runsExecuted());
        return ResponseEntity.ok(success(quotaTracker.update(id, request.maxRuns(), request.runsExecuted())));
    }

    @PostMapping("/{id}/block")
    public ResponseEntity<Map<String, Object>> block(@PathVariable Long id, @RequestBody BlockQuotaRequest request) {
        log.info("POST /api/v1/quotas/{}/block - reason={}", id, request.reason());
        return ResponseEntity.ok(success(quotaTracker.block(id, request.reason())));
    }

    @PostMapping("/{id}/unblock")
    public ResponseEntity<Map<String, Object>> unblock(@PathVariable Long id) {
        log.info("POST /api/v1/quotas/{}/unblock", id);
        return ResponseEntity.ok(success(quotaTracker.unblock(id)));
    }

    @PostMapping("/{id}/runs")
    public ResponseEntity<Map<String, Object>> registerRun(@PathVariable Long id) {
        log.info("POST /api/v1/quotas/{}/runs", id);
        return ResponseEntity.ok(success(quotaTracker.registerRun(id)));
    }

    @PostMapping("/competitors/{competitorId}/provision")
    public ResponseEntity<Map<String, Object>> autoProvision(@PathVariable Long competitorId) {
        log.info("POST /api/v1/quotas/competitors/{}/provision", competitorId);
        List<QuotaView> created = quotaTracker.autoProvision(competitorId).stream().map(QuotaView::from).toList();

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("created", created);
        response.put("count", created.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<QuotaView> get(@PathVariable Long id) {
        return ResponseEntity.ok(QuotaView.from(quotaTracker.getQuota(id)));
    }

    @GetMapping("/competitors/{competitorId}")
    public ResponseEntity<List<QuotaView>> forCompetitor(@PathVariable Long competitorId) {
        return ResponseEntity.ok(quotaTracker.listForCompetitor(competitorId).stream().map(QuotaView::from).toList());
    }

    @GetMapping
    public ResponseEntity<List<QuotaView>> list(@RequestParam(required = false) Long provaId,
                                                @RequestParam(required = false) Long categoryId,
                                                @RequestParam(defaultValue = "false") boolean onlyBlocked) {
        return ResponseEntity.ok(quotaTracker.list(provaId, categoryId, onlyBlocked).stream().map(QuotaView::from).toList());
    }

    private static Map<String, Object> success(ParticipationQuota quota) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("quota", QuotaView.from(quota));
        return response;
    }
}
