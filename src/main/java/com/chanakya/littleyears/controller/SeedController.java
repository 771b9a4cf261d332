package com.chanakya.littleyears.controller;

import com.chanakya.littleyears.model.dto.response.SeedResponse;
import com.chanakya.littleyears.service.SeedService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/seed")
public class SeedController {

    private final SeedService seedService;

    public SeedController(SeedService seedService) {
        this.seedService = seedService;
    }

    @PostMapping
    public Mono<SeedResponse> seed() {
        return seedService.seedDemo();
    }
}
