package com.chanakya.littleyears.model.dto.response;

public record ErrorResponse(
        String error,
        String message
) {}
