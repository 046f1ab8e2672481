package com.lctp.trio.model.dto;

import java.util.List;

public record ValidateTrioRequest(Long categoryId, List<Long> competitorIds) {
}
