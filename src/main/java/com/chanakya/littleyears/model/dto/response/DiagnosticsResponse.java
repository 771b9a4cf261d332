package com.chanakya.littleyears.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticsResponse(
        String backend,
        String database,
        List<String> collections
) {}
