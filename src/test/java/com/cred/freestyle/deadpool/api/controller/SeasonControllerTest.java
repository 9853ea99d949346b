package com.cred.freestyle.deadpool.api.controller;

import com.cred.freestyle.deadpool.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord.TransitionStatus;
import com.cred.freestyle.deadpool.exception.DraftOrderExistsException;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.service.SeasonSetupService;
import com.cred.freestyle.deadpool.service.transition.SeasonTransitionService;
import com.cred.freestyle.deadpool.service.transition.TransitionFailure;
import com.cred.freestyle.deadpool.service.transition.TransitionReport;
import com.cred.freestyle.deadpool.service.transition.TransitionStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for SeasonController using MockMvc.
 */
@WebMvcTest(SeasonController.class)
@ContextConfiguration(classes = {SeasonController.class, GlobalExceptionHandler.class})
@DisplayName("SeasonController Tests")
class SeasonControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SeasonSetupService seasonSetupService;

    @MockBean
    private SeasonTransitionService transitionService;

    // ========================================
    // POST /api/v1/seasons/{year}/draft-order Tests
    // ========================================

    @Test
    @DisplayName("POST /{year}/draft-order - Returns 201 with positions")
    void draftOrder_Valid_Returns201() throws Exception {
        // Given
        String requestBody = """
                {
                    "playerIds": ["alice", "bob"]
                }
                """;
        when(seasonSetupService.initializeDraftOrder(2025, List.of("alice", "bob"))).thenReturn(List.of(
                DraftOrderEntry.builder().year(2025).position(1).playerId("alice").build(),
                DraftOrderEntry.builder().year(2025).position(2).playerId("bob").build()));

        // When / Then
        mockMvc.perform(post("/api/v1/seasons/2025/draft-order")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].position").value(2));
    }

    @Test
    @DisplayName("POST /{year}/draft-order - Empty list returns 400")
    void draftOrder_Empty_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/seasons/2025/draft-order")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerIds\": []}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(seasonSetupService);
    }

    @Test
    @DisplayName("POST /{year}/draft-order - Existing order returns 409")
    void draftOrder_Exists_Returns409() throws Exception {
        when(seasonSetupService.initializeDraftOrder(eq(2025), anyList()))
                .thenThrow(new DraftOrderExistsException(2025));

        mockMvc.perform(post("/api/v1/seasons/2025/draft-order")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerIds\": [\"alice\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.reason").value("DRAFT_ORDER_EXISTS"));
    }

    // ========================================
    // POST /api/v1/seasons/transitions Tests
    // ========================================

    @Test
    @DisplayName("POST /transitions - Dry run returns the report")
    void transition_DryRun_Returns200() throws Exception {
        // Given
        String requestBody = """
                {
                    "fromYear": 2024,
                    "toYear": 2025,
                    "dryRun": true
                }
                """;
        TransitionReport report = TransitionReport.builder()
                .fromYear(2024).toYear(2025).dryRun(true)
                .status(TransitionStatus.COMPLETED).picksCarried(21).picksRemoved(2)
                .build();
        when(transitionService.runTransition(2024, 2025, true, false)).thenReturn(report);

        // When / Then
        mockMvc.perform(post("/api/v1/seasons/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.picksCarried").value(21))
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    @DisplayName("POST /transitions - Partial failures still return 200 with the failures listed")
    void transition_WithErrors_Returns200() throws Exception {
        TransitionReport report = TransitionReport.builder()
                .fromYear(2024).toYear(2025)
                .status(TransitionStatus.COMPLETED_WITH_ERRORS)
                .failures(List.of(new TransitionFailure("bob", TransitionStage.CARRY_FORWARD_PICKS, "held by dave")))
                .build();
        when(transitionService.runTransition(2024, 2025, false, false)).thenReturn(report);

        mockMvc.perform(post("/api/v1/seasons/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromYear\": 2024, \"toYear\": 2025}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED_WITH_ERRORS"))
                .andExpect(jsonPath("$.failures[0].playerId").value("bob"));
    }

    @Test
    @DisplayName("POST /transitions - Missing toYear returns 400")
    void transition_MissingYear_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/seasons/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromYear\": 2024}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.toYear").exists());
    }

    @Test
    @DisplayName("POST /transitions - Years out of order returns 400")
    void transition_BadYears_Returns400() throws Exception {
        when(transitionService.runTransition(2025, 2024, false, false))
                .thenThrow(new IllegalArgumentException("toYear must be after fromYear"));

        mockMvc.perform(post("/api/v1/seasons/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromYear\": 2025, \"toYear\": 2024}"))
                .andExpect(status().isBadRequest());
    }

    // ========================================
    // GET /api/v1/seasons/transitions/{from}/{to} Tests
    // ========================================

    @Test
    @DisplayName("GET /transitions/{from}/{to} - Returns the stored record")
    void record_Found() throws Exception {
        when(transitionService.getTransitionRecord(2024, 2025)).thenReturn(SeasonTransitionRecord.builder()
                .fromYear(2024).toYear(2025).status(TransitionStatus.COMPLETED).attempts(2).build());

        mockMvc.perform(get("/api/v1/seasons/transitions/2024/2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attempts").value(2))
                .andExpect(jsonPath("$.strategy").value("ACTIVE_PICKS_ONLY"));
    }

    @Test
    @DisplayName("GET /transitions/{from}/{to} - Unknown transition returns 404")
    void record_NotFound() throws Exception {
        when(transitionService.getTransitionRecord(2020, 2021))
                .thenThrow(new ResourceNotFoundException("Season transition", "2020->2021"));

        mockMvc.perform(get("/api/v1/seasons/transitions/2020/2021"))
                .andExpect(status().isNotFound());
    }
}
