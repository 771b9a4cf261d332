package com.chanakya.littleyears.model.dto.response;

import java.util.List;

public record TimelineResponse(
        KidResponse kid,
        List<MomentResponse> moments,
        boolean includesPrivate
) {}
