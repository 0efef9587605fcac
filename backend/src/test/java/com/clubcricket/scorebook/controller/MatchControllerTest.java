package com.clubcricket.scorebook.controller;

import com.clubcricket.scorebook.config.ScoringLimits;
import com.clubcricket.scorebook.dto.CreateMatchRequest;
import com.clubcricket.scorebook.exception.IllegalStateTransitionException;
import com.clubcricket.scorebook.exception.InvalidDeliveryException;
import com.clubcricket.scorebook.exception.NotFoundException;
import com.clubcricket.scorebook.exception.NothingToUndoException;
import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.InningsStatus;
import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.model.MatchStatus;
import com.clubcricket.scorebook.scoring.Delivery;
import com.clubcricket.scorebook.scoring.DeliveryOutcome;
import com.clubcricket.scorebook.scoring.ScoringEngine;
import com.clubcricket.scorebook.service.BallLogCsvExporter;
import com.clubcricket.scorebook.service.MatchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MatchController.class)
@ActiveProfiles("test")
class MatchControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private MatchService matchService;
    @MockBean private BallLogCsvExporter csvExporter;

    private Match match;
    private Innings innings;

    @BeforeEach
    void setUp() {
        match = new Match("Lions", "Tigers", 20, "Oval");
        match.setId(7L);
        match.setStatus(MatchStatus.IN_PROGRESS);
        innings = new Innings(1, "Lions", "Tigers", "Ann", "Ben", "Zed");
        innings.setStatus(InningsStatus.IN_PROGRESS);
        match.addInnings(innings);
    }

    @Test
    void createReturns201WithMatch() throws Exception {
        Match created = new Match("Lions", "Tigers", 20, null);
        created.setId(1L);
        when(matchService.create(any(CreateMatchRequest.class))).thenReturn(created);

        mockMvc.perform(post("/api/matches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teamAName\":\"Lions\",\"teamBName\":\"Tigers\",\"totalOvers\":20}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.status").value("TOSS"))
                .andExpect(jsonPath("$.totalOvers").value(20));
    }

    @Test
    void recordBallReturnsOutcomeAndMatch() throws Exception {
        DeliveryOutcome outcome = new ScoringEngine(new ScoringLimits(50, 7)).apply(match, innings, Delivery.boundaryFour());
        when(matchService.recordBall(eq(7L), any(Delivery.class))).thenReturn(outcome);

        mockMvc.perform(post("/api/matches/7/ball")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runsScored\":4,\"boundaryFour\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overComplete").value(false))
                .andExpect(jsonPath("$.inningsEnded").value(false))
                .andExpect(jsonPath("$.match.innings[0].totalRuns").value(4))
                .andExpect(jsonPath("$.match.innings[0].oversBowled").value("0.1"))
                .andExpect(jsonPath("$.match.innings[0].balls[0].boundaryFour").value(true));
    }

    @Test
    void undoReturnsMessageAndMatch() throws Exception {
        ScoringEngine engine = new ScoringEngine(new ScoringLimits(50, 7));
        engine.apply(match, innings, Delivery.runs(2));
        BallEvent undone = engine.undoLast(innings);
        when(matchService.undoLastBall(7L)).thenReturn(undone);

        mockMvc.perform(post("/api/matches/7/undo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Last ball undone (0.0)."))
                .andExpect(jsonPath("$.undone.runsScored").value(2))
                .andExpect(jsonPath("$.match.innings[0].totalRuns").value(0))
                .andExpect(jsonPath("$.match.innings[0].balls").isEmpty());
    }

    @Test
    void invalidDeliveryMapsTo400() throws Exception {
        when(matchService.recordBall(eq(7L), any(Delivery.class)))
                .thenThrow(new InvalidDeliveryException("Ball cannot be both four and six."));

        mockMvc.perform(post("/api/matches/7/ball")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runsScored\":4,\"boundaryFour\":true,\"boundarySix\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_DELIVERY"))
                .andExpect(jsonPath("$.message").value("Ball cannot be both four and six."));
    }

    @Test
    void illegalTransitionAndNothingToUndoMapTo409() throws Exception {
        when(matchService.swapStrike(7L)).thenThrow(new IllegalStateTransitionException("No active innings found."));
        when(matchService.undoLastBall(7L)).thenThrow(new NothingToUndoException("No balls to undo."));

        mockMvc.perform(post("/api/matches/7/swap-strike"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ILLEGAL_STATE_TRANSITION"));
        mockMvc.perform(post("/api/matches/7/undo"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("NOTHING_TO_UNDO"));
    }

    @Test
    void unknownMatchMapsTo404() throws Exception {
        when(matchService.get(99L)).thenThrow(new NotFoundException("Match not found: 99"));

        mockMvc.perform(get("/api/matches/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void badInputMapsTo400() throws Exception {
        when(matchService.create(any(CreateMatchRequest.class)))
                .thenThrow(new IllegalArgumentException("Team names must be different."));

        mockMvc.perform(post("/api/matches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teamAName\":\"A\",\"teamBName\":\"A\",\"totalOvers\":20}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Team names must be different."));
        mockMvc.perform(post("/api/matches/7/ball")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"extraType\":\"BOUNCER\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void unexpectedFailureIsOpaque500() throws Exception {
        when(matchService.getScorecard(7L)).thenThrow(new RuntimeException("connection reset"));

        mockMvc.perform(get("/api/matches/7/scorecard"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL"))
                .andExpect(jsonPath("$.message").value("Internal error"));
    }

    @Test
    void deleteReturns204AndRejectsLiveMatch() throws Exception {
        mockMvc.perform(delete("/api/matches/7")).andExpect(status().isNoContent());
        verify(matchService).deleteMatch(7L);

        doThrow(new IllegalStateTransitionException("Only completed or abandoned matches can be deleted."))
                .when(matchService).deleteMatch(8L);
        mockMvc.perform(delete("/api/matches/8")).andExpect(status().isConflict());
    }

    @Test
    void listReturnsSummaries() throws Exception {
        when(matchService.list(MatchStatus.IN_PROGRESS)).thenReturn(List.of(match));

        mockMvc.perform(get("/api/matches").param("status", "IN_PROGRESS"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(7))
                .andExpect(jsonPath("$[0].teamBName").value("Tigers"));
    }

    @Test
    void ballLogIsServedAsCsv() throws Exception {
        when(matchService.getInnings(7L, 1)).thenReturn(innings);
        when(csvExporter.export(innings)).thenReturn("sequence,over\n1,0\n");

        mockMvc.perform(get("/api/matches/7/innings/1/balls.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"match-7-innings-1.csv\""))
                .andExpect(content().string("sequence,over\n1,0\n"));
    }
}
