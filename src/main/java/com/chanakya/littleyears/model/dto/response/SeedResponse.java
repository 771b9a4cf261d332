package com.chanakya.littleyears.model.dto.response;

import java.util.List;

public record SeedResponse(
        List<String> inserted
) {}
