package com.lctp.trio.model.dto;

import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.TrioStatus;

import java.util.List;

public record TrioView(Long id,
                       Long provaId,
                       Long categoryId,
                       Integer trioNumber,
                       List<Long> competitorIds,
                       Integer handicapTotal,
                       Integer ageTotal,
                       TrioStatus status,
                       boolean manualFormation) {

    public static TrioView from(Trio trio) {
        return new TrioView(
                trio.getId(),
                trio.getProva().getId(),
                trio.getCategory().getId(),
                trio.getTrioNumber(),
                trio.memberIds(),
                trio.getHandicapTotal(),
                trio.getAgeTotal(),
                trio.getStatus(),
                trio.isManualFormation());
    }
}
