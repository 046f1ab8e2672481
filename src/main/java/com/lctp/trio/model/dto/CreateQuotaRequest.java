package com.lctp.trio.model.dto;

public record CreateQuotaRequest(Long competitorId, Long provaId, Long categoryId, Integer maxRuns) {
}
