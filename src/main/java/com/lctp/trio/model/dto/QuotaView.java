package com.lctp.trio.model.dto;

import com.lctp.trio.entity.ParticipationQuota;
import com.lctp.trio.enums.QuotaState;

public record QuotaView(Long id,
                        Long competitorId,
                        Long provaId,
                        Long categoryId,
                        int maxRunsAllowed,
                        int runsExecuted,
                        int runsRemaining,
                        boolean mayCompete,
                        String blockReason,
                        QuotaState state) {

    public static QuotaView from(ParticipationQuota quota) {
        return new QuotaView(
                quota.getId(),
                quota.getCompetitor().getId(),
                quota.getProva().getId(),
                quota.getCategory().getId(),
                quota.getMaxRunsAllowed(),
                quota.getRunsExecuted(),
                quota.getRunsRemaining(),
                quota.isMayCompete(),
                quota.getBlockReason(),
                quota.getState());
    }
}
