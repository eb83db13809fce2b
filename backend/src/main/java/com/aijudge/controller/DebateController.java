package com.aijudge.controller;

import com.aijudge.dto.DebateRequests;
import com.aijudge.dto.DebateResponses;
import com.aijudge.service.DebateService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class DebateController {

    private final DebateService debateService;

    public DebateController(DebateService debateService) {
        this.debateService = debateService;
    }

    /**
     * Queues a debate for the case. The body is optional; without it the emotional lawyer prosecutes.
     */
    @PostMapping("/debate/start/{caseId}")
    public ResponseEntity<DebateResponses.DebateStarted> startDebate(
            @PathVariable UUID caseId,
            @RequestBody(required = false) DebateRequests.StartDebateRequest request
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(debateService.startDebate(caseId, request));
    }

    @GetMapping("/debate/{debateId}")
    public ResponseEntity<DebateResponses.DebateDetail> getDebate(@PathVariable UUID debateId) {
        return ResponseEntity.ok(debateService.getDebate(debateId));
    }

    @GetMapping("/debates")
    public ResponseEntity<List<DebateResponses.DebateSummary>> listDebates() {
        return ResponseEntity.ok(debateService.listDebates());
    }
}
