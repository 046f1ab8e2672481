package com.lctp.trio.model.dto;

import java.util.List;

/**
 * @param trioNumber optional; the next free number is used when absent
 */
public record CreateTrioRequest(Long provaId, Long categoryId, List<Long> competitorIds, Integer trioNumber) {
}
