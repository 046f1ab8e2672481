package com.lctp.trio.model.dto;

import java.util.List;

public record DrawRequest(Long provaId, Long categoryId, List<Long> competitorIds) {
}
