package com.clubcricket.scorebook.dto;

import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.model.MatchStatus;

import java.time.LocalDateTime;

public class MatchListItem {
    private Long id;
    private String teamAName;
    private String teamBName;
    private int totalOvers;
    private String venue;
    private MatchStatus status;
    private String resultSummary;
    private LocalDateTime createdAt;

    public MatchListItem() {}

    public static MatchListItem from(Match m) {
        MatchListItem item = new MatchListItem();
        item.id = m.getId();
        item.teamAName = m.getTeamAName();
        item.teamBName = m.getTeamBName();
        item.totalOvers = m.getTotalOvers() == null ? 0 : m.getTotalOvers();
        item.venue = m.getVenue();
        item.status = m.getStatus();
        item.resultSummary = m.getResultSummary();
        item.createdAt = m.getCreatedAt();
        return item;
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

    public MatchStatus getStatus() { return status; }
    public void setStatus(MatchStatus status) { this.status = status; }

    public String getResultSummary() { return resultSummary; }
    public void setResultSummary(String resultSummary) { this.resultSummary = resultSummary; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
