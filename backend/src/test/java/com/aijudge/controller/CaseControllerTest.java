package com.aijudge.controller;

import com.aijudge.dto.DebateRequests;
import com.aijudge.dto.DebateResponses;
import com.aijudge.service.DebateService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CaseController.class)
class CaseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DebateService debateService;

    @Test
    void createCaseReturnsCreatedCaseId() throws Exception {
        UUID caseId = UUID.fromString("00000000-0000-0000-0000-000000000101");
        when(debateService.createCase(eq(new DebateRequests.CreateCaseRequest(
                "Withheld deposit",
                "The landlord kept the whole deposit after a clean move-out."
        )))).thenReturn(new DebateResponses.CaseCreated(caseId));

        mockMvc.perform(post("/api/case/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "title": "Withheld deposit",
                                  "description": "The landlord kept the whole deposit after a clean move-out."
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.case_id").value(caseId.toString()));
    }

    @Test
    void createCaseWithShortFieldsReturnsFieldErrors() throws Exception {
        mockMvc.perform(post("/api/case/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "title": "ab",
                                  "description": "too short"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").exists())
                .andExpect(jsonPath("$.field_errors.title").exists())
                .andExpect(jsonPath("$.field_errors.description").exists());

        verify(debateService, never()).createCase(any());
    }

    @Test
    void createCaseWithMissingTitleReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/case/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "description": "The landlord kept the whole deposit after a clean move-out."
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field_errors.title").exists());

        verify(debateService, never()).createCase(any());
    }

    @Test
    void malformedBodyReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/case/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));

        verify(debateService, never()).createCase(any());
    }
}
