package com.clubcricket.scorebook.controller;

import com.clubcricket.scorebook.exception.NotFoundException;
import com.clubcricket.scorebook.repository.ScoringAuditRepository;
import com.clubcricket.scorebook.scoring.RebuildReport;
import com.clubcricket.scorebook.service.MatchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AdminScoringController.class)
@ActiveProfiles("test")
class AdminScoringControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private MatchService matchService;
    @MockBean private ScoringAuditRepository auditRepository;

    @Test
    void rebuildReportsCorrections() throws Exception {
        when(matchService.rebuildInnings(3L, 1))
                .thenReturn(new RebuildReport(1, 12, List.of("totalRuns: 40 -> 38")));

        mockMvc.perform(post("/api/admin/matches/3/innings/1/rebuild"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.drifted").value(true))
                .andExpect(jsonPath("$.activeEvents").value(12))
                .andExpect(jsonPath("$.corrections[0]").value("totalRuns: 40 -> 38"));
    }

    @Test
    void rebuildOfMissingInningsIs404() throws Exception {
        when(matchService.rebuildInnings(3L, 2)).thenThrow(new NotFoundException("Innings 2 not found for match 3"));

        mockMvc.perform(post("/api/admin/matches/3/innings/2/rebuild"))
                .andExpect(status().isNotFound());
    }
}
