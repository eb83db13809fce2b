package com.aijudge.controller;

import com.aijudge.dto.DebateRequests;
import com.aijudge.dto.DebateResponses;
import com.aijudge.model.AgentKind;
import com.aijudge.model.DebateRole;
import com.aijudge.model.DebateStatus;
import com.aijudge.model.VerdictSource;
import com.aijudge.model.Winner;
import com.aijudge.service.DebateService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DebateController.class)
class DebateControllerTest {

    private static final UUID CASE_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID DEBATE_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DebateService debateService;

    @Test
    void startDebateWithoutBodyReturnsAccepted() throws Exception {
        when(debateService.startDebate(eq(CASE_ID), isNull()))
                .thenReturn(new DebateResponses.DebateStarted(DEBATE_ID, DebateStatus.IN_PROGRESS));

        mockMvc.perform(post("/api/debate/start/{caseId}", CASE_ID))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.debate_id").value(DEBATE_ID.toString()))
                .andExpect(jsonPath("$.status").value("in_progress"));
    }

    @Test
    void startDebatePassesRequestedEmotionalRole() throws Exception {
        when(debateService.startDebate(eq(CASE_ID), eq(new DebateRequests.StartDebateRequest(DebateRole.DEFENSE))))
                .thenReturn(new DebateResponses.DebateStarted(DEBATE_ID, DebateStatus.IN_PROGRESS));

        mockMvc.perform(post("/api/debate/start/{caseId}", CASE_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"emotional_role": "defense"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.debate_id").value(DEBATE_ID.toString()));
    }

    @Test
    void startDebateForUnknownCaseReturnsNotFound() throws Exception {
        when(debateService.startDebate(eq(CASE_ID), any()))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Case not found: " + CASE_ID));

        mockMvc.perform(post("/api/debate/start/{caseId}", CASE_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    void startDebateWithInvalidCaseIdReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/debate/start/{caseId}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Invalid value for caseId"))
                .andExpect(jsonPath("$.field_errors.caseId").value("has an invalid format"));

        verify(debateService, never()).startDebate(any(), any());
    }

    @Test
    void getDebateReturnsTranscriptPayload() throws Exception {
        when(debateService.getDebate(DEBATE_ID)).thenReturn(sampleDetail());

        mockMvc.perform(get("/api/debate/{debateId}", DEBATE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.debate_id").value(DEBATE_ID.toString()))
                .andExpect(jsonPath("$.case.case_id").value(CASE_ID.toString()))
                .andExpect(jsonPath("$.case.title").value("Withheld deposit"))
                .andExpect(jsonPath("$.rounds.length()").value(3))
                .andExpect(jsonPath("$.rounds[0][0].lawyer").value("emotional"))
                .andExpect(jsonPath("$.rounds[0][0].round_number").value(1))
                .andExpect(jsonPath("$.rounds[0][1].lawyer").value("logical"))
                .andExpect(jsonPath("$.verdict.winner").value("logical"))
                .andExpect(jsonPath("$.verdict.emotional_score").value(58))
                .andExpect(jsonPath("$.verdict.criteria_scores.evidence").value(17))
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.verdict_source").value(VerdictSource.STRICT.wireValue()))
                .andExpect(jsonPath("$.emotional_role").value("prosecution"));
    }

    @Test
    void getUnknownDebateReturnsNotFound() throws Exception {
        when(debateService.getDebate(DEBATE_ID))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Debate not found: " + DEBATE_ID));

        mockMvc.perform(get("/api/debate/{debateId}", DEBATE_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    void listDebatesReturnsSummaries() throws Exception {
        OffsetDateTime createdAt = OffsetDateTime.parse("2026-03-01T10:15:30Z");
        when(debateService.listDebates()).thenReturn(List.of(
                new DebateResponses.DebateSummary(DEBATE_ID, CASE_ID, "Withheld deposit",
                        DebateStatus.COMPLETE, Winner.EMOTIONAL, createdAt),
                new DebateResponses.DebateSummary(UUID.randomUUID(), CASE_ID, "Withheld deposit",
                        DebateStatus.IN_PROGRESS, null, createdAt.minusHours(1))
        ));

        mockMvc.perform(get("/api/debates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].debate_id").value(DEBATE_ID.toString()))
                .andExpect(jsonPath("$[0].case_title").value("Withheld deposit"))
                .andExpect(jsonPath("$[0].winner").value("emotional"))
                .andExpect(jsonPath("$[1].status").value("in_progress"))
                .andExpect(jsonPath("$[1].winner").doesNotExist());
    }

    private static DebateResponses.DebateDetail sampleDetail() {
        List<List<DebateResponses.ArgumentDetail>> rounds = List.of(
                List.of(
                        new DebateResponses.ArgumentDetail(AgentKind.EMOTIONAL, 1, "They trusted the landlord.", 4),
                        new DebateResponses.ArgumentDetail(AgentKind.LOGICAL, 1, "The lease sets the terms.", 5)
                ),
                List.of(),
                List.of()
        );
        return new DebateResponses.DebateDetail(
                DEBATE_ID,
                new DebateResponses.CaseDetail(CASE_ID, "Withheld deposit", "The landlord kept the deposit."),
                rounds,
                new DebateResponses.VerdictDetail(58, 77, Winner.LOGICAL, "The lease terms decided the case.",
                        new DebateResponses.CriteriaScoresDetail(15, 16, 17, 14, 15)),
                DebateStatus.COMPLETE,
                OffsetDateTime.parse("2026-03-01T10:15:30Z"),
                VerdictSource.STRICT,
                DebateRole.PROSECUTION
        );
    }
}
