package com.lctp.trio.model;

import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.DrawMode;

import java.util.List;

public record DrawResult(DrawMode mode,
                         List<Trio> trios,
                         List<Long> drawnCompetitorIds,
                         List<Long> notDrawnCompetitorIds,
                         List<Long> ineligibleCompetitorIds) {

    public int totalTrios() {
        return trios.size();
    }
}
