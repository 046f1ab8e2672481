package com.lctp.trio.model.dto;

import java.math.BigDecimal;
import java.util.List;

public record RecordRunRequest(List<BigDecimal> attemptTimes,
                               Boolean noTime,
                               Boolean disqualified,
                               BigDecimal prize,
                               String notes) {
}
