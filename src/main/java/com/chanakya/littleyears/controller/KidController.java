package com.chanakya.littleyears.controller;

import com.chanakya.littleyears.model.dto.response.KidResponse;
import com.chanakya.littleyears.model.dto.response.TimelineResponse;
import com.chanakya.littleyears.service.KidService;
import com.chanakya.littleyears.service.TimelineService;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

// The grandparent parameter is a claim, not an authenticated identity
@RestController
@RequestMapping("/api/kids")
public class KidController {

    private final KidService kidService;
    private final TimelineService timelineService;

    public KidController(KidService kidService, TimelineService timelineService) {
        this.kidService = kidService;
        this.timelineService = timelineService;
    }

    /**
     * List kids, optionally only those shared with a grandparent.
     */
    @GetMapping
    public Flux<KidResponse> listKids(@RequestParam(required = false) String grandparent) {
        return kidService.listKids(grandparent);
    }

    /**
     * Timeline for one kid, newest first.
     */
    @GetMapping("/{kidId}/timeline")
    public Mono<TimelineResponse> getTimeline(
            @PathVariable String kidId,
            @RequestParam(name = "include_private", defaultValue = "false") boolean includePrivate,
            @RequestParam(required = false) String grandparent) {
        return timelineService.getTimeline(kidId, includePrivate, grandparent);
    }
}
