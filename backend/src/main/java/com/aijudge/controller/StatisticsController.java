package com.aijudge.controller;

import com.aijudge.dto.DebateResponses;
import com.aijudge.service.DebateService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/statistics")
public class StatisticsController {

    private final DebateService debateService;

    public StatisticsController(DebateService debateService) {
        this.debateService = debateService;
    }

    @GetMapping
    public ResponseEntity<DebateResponses.Statistics> getStatistics() {
        return ResponseEntity.ok(debateService.getStatistics());
    }
}
