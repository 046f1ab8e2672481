package com.lctp.trio.model.dto;

import com.lctp.trio.entity.RunResult;

import java.math.BigDecimal;

public record ResultView(Long id,
                         Long trioId,
                         Integer trioNumber,
                         Long categoryId,
                         BigDecimal firstAttemptTime,
                         BigDecimal secondAttemptTime,
                         BigDecimal averageTime,
                         boolean noTime,
                         boolean disqualified,
                         Integer placement,
                         BigDecimal prizeAmount,
                         BigDecimal netPrizeAmount) {

    public static ResultView from(RunResult result) {
        return new ResultView(
                result.getId(),
                result.getTrio().getId(),
                result.getTrio().getTrioNumber(),
                result.getTrio().getCategory().getId(),
                result.getFirstAttemptTime(),
                result.getSecondAttemptTime(),
                result.getAverageTime(),
                result.isNoTime(),
                result.isDisqualified(),
                result.getPlacement(),
                result.getPrizeAmount(),
                result.getNetPrizeAmount());
    }
}
