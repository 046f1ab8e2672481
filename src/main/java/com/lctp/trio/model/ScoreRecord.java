package com.lctp.trio.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Championship points earned by one competitor for one trio result.
 */
@Builder(toBuilder = true)
public record ScoreRecord(Long competitorId,
                          Long trioId,
                          Long resultId,
                          Long eventId,
                          Long categoryId,
                          Integer placement,
                          int fieldSize,
                          BigDecimal placementPoints,
                          BigDecimal prizePoints,
                          BigDecimal prizeShare,
                          BigDecimal totalPoints) {
}
