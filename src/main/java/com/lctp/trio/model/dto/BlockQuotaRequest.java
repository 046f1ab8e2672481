package com.lctp.trio.model.dto;

public record BlockQuotaRequest(String reason) {
}
