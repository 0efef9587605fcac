package com.clubcricket.scorebook.dto;

public class CreateMatchRequest {
    private String teamAName;
    private String teamBName;
    private Integer totalOvers;
    private String venue; // optional

    public CreateMatchRequest() {}

    public CreateMatchRequest(String teamAName, String teamBName, Integer totalOvers, String venue) {
        this.teamAName = teamAName;
        this.teamBName = teamBName;
        this.totalOvers = totalOvers;
        this.venue = venue;
    }

    public String getTeamAName() { return teamAName; }
    public void setTeamAName(String teamAName) { this.teamAName = teamAName; }

    public String getTeamBName() { return teamBName; }
    public void setTeamBName(String teamBName) { this.teamBName = teamBName; }

    public Integer getTotalOvers() { return totalOvers; }
    public void setTotalOvers(Integer totalOvers) { this.totalOvers = totalOvers; }

    public String getVenue() { return venue; }
    public void setVenue(String venue) { this.venue = venue; }
}
