package com.aijudge.controller;

import com.aijudge.dto.DebateRequests;
import com.aijudge.dto.DebateResponses;
import com.aijudge.service.DebateService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/case")
public class CaseController {

    private final DebateService debateService;

    public CaseController(DebateService debateService) {
        this.debateService = debateService;
    }

    @PostMapping("/create")
    public ResponseEntity<DebateResponses.CaseCreated> createCase(
            @Valid @RequestBody DebateRequests.CreateCaseRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(debateService.createCase(request));
    }
}
