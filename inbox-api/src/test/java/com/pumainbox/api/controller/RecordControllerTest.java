package com.pumainbox.api.controller;

import com.pumainbox.api.service.RecordQueryService;
import com.pumainbox.api.service.ValidationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.test.web.servlet.MockMvc;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RecordController.class)
class RecordControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecordQueryService recordQueryService;

    @MockBean
    private ValidationService validationService;

    @Test
    void testListCases_Defaults() throws Exception {
        // Given
        when(recordQueryService.listCases(20, 0))
                .thenReturn(List.of(Map.of("case_id", 12, "status", "open")));

        // When & Then
        mockMvc.perform(get("/cases"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].case_id").value(12))
                .andExpect(jsonPath("$[0].status").value("open"));
    }

    @Test
    void testListAiDecisions_Paginated() throws Exception {
        // Given
        when(recordQueryService.listAiDecisions(5, 10))
                .thenReturn(List.of(Map.of("decision", "escalate")));

        // When & Then
        mockMvc.perform(get("/ai-decisions").param("limit", "5").param("offset", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].decision").value("escalate"));

        verify(recordQueryService).listAiDecisions(5, 10);
    }

    @Test
    void testListRiskEvents_Empty() throws Exception {
        // Given
        when(recordQueryService.listRiskEvents(0, 0)).thenReturn(List.of());

        // When & Then
        mockMvc.perform(get("/risk-events").param("limit", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void testListRiskEvents_RejectedPagination() throws Exception {
        // Given
        when(validationService.validatePagination(20, -3))
                .thenReturn(List.of("offset: must be greater than or equal to 0"));

        // When & Then
        mockMvc.perform(get("/risk-events").param("offset", "-3"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0]").value("offset: must be greater than or equal to 0"));

        verify(recordQueryService, never()).listRiskEvents(anyInt(), anyInt());
    }

    @Test
    void testListCases_MissingTable() throws Exception {
        // Given
        when(recordQueryService.listCases(20, 0))
                .thenThrow(new BadSqlGrammarException("PreparedStatementCallback",
                        "SELECT * FROM \"Puma_L1_AI\".cases",
                        new SQLException("ERROR: relation \"Puma_L1_AI.cases\" does not exist")));

        // When & Then
        mockMvc.perform(get("/cases"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("ERROR: relation \"Puma_L1_AI.cases\" does not exist"));
    }

    @Test
    void testListAiDecisions_DatabaseDown() throws Exception {
        // Given
        when(recordQueryService.listAiDecisions(20, 0))
                .thenThrow(new DataAccessResourceFailureException("Connection reset"));

        // When & Then
        mockMvc.perform(get("/ai-decisions"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Connection reset"));
    }

    @Test
    void testListRiskEvents_UnexpectedFailure() throws Exception {
        // Given
        when(recordQueryService.listRiskEvents(20, 0)).thenThrow(new IllegalArgumentException("Unsupported column"));

        // When & Then
        mockMvc.perform(get("/risk-events"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Unsupported column"));
    }
}
