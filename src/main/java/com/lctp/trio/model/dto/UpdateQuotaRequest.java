package com.lctp.trio.model.dto;

public record UpdateQuotaRequest(Integer maxRuns, Integer runsExecuted) {
}
