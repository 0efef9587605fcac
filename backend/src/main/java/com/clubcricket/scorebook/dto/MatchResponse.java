package com.clubcricket.scorebook.dto;

import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.model.MatchStatus;
import com.clubcricket.scorebook.model.TossDecision;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class MatchResponse {
    private Long id;
    private String teamAName;
    private String teamBName;
    private int totalOvers;
    private String venue;
    private String tossWinner;
    private TossDecision tossDecision;
    private MatchStatus status;
    private String resultSummary;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<InningsResponse> innings = new ArrayList<>();

    public MatchResponse() {}

    public static MatchResponse from(Match m) {
        MatchResponse r = new MatchResponse();
        r.id = m.getId();
        r.teamAName = m.getTeamAName();
        r.teamBName = m.getTeamBName();
        r.totalOvers = m.getTotalOvers() == null ? 0 : m.getTotalOvers();
        r.venue = m.getVenue();
        r.tossWinner = m.getTossWinner();
        r.tossDecision = m.getTossDecision();
        r.status = m.getStatus();
        r.resultSummary = m.getResultSummary();
        r.createdAt = m.getCreatedAt();
        r.updatedAt = m.getUpdatedAt();
        r.innings = m.getInnings().stream().map(InningsResponse::from).toList();
        return r;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getTeamAName() { return teamAName; }
    public void setTeamAName(String teamAName) { this.teamAName = teamAName; }

    public String getTeamBName() { return teamBName; }
    public void setTeamBName(String teamBName) { this.teamBName = teamBName; }

    public int getTotalOvers() { return totalOvers; }
    public void setTotalOvers(int totalOvers) { this.totalOvers = totalOvers; }

    public String getVenue() { return venue; }
    public void setVenue(String venue) { this.venue = venue; }

    public String getTossWinner() { return tossWinner; }
    public void setTossWinner(String tossWinner) { this.tossWinner = tossWinner; }

    public TossDecision getTossDecision() { return tossDecision; }
    public void setTossDecision(TossDecision tossDecision) { this.tossDecision = tossDecision; }

    public MatchStatus getStatus() { return status; }
    public void setStatus(MatchStatus status) { this.status = status; }

    public String getResultSummary() { return resultSummary; }
    public void setResultSummary(String resultSummary) { this.resultSummary = resultSummary; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    public List<InningsResponse> getInnings() { return innings; }
    public void setInnings(List<InningsResponse> innings) { this.innings = innings; }
}
