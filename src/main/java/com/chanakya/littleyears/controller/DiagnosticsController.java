package com.chanakya.littleyears.controller;

import com.chanakya.littleyears.model.dto.response.DiagnosticsResponse;
import com.chanakya.littleyears.service.DiagnosticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class DiagnosticsController {

    private final DiagnosticsService diagnosticsService;

    public DiagnosticsController(DiagnosticsService diagnosticsService) {
        this.diagnosticsService = diagnosticsService;
    }

    @GetMapping("/")
    public Mono<Map<String, String>> healthcheck() {
        return Mono.just(Map.of("status", "ok"));
    }

    @GetMapping("/test")
    public Mono<DiagnosticsResponse> testDatabase() {
        return diagnosticsService.checkDatabase();
    }

    @GetMapping("/api/hello")
    public Mono<Map<String, String>> hello() {
        return Mono.just(Map.of("message", "Hello from the backend API!"));
    }
}
