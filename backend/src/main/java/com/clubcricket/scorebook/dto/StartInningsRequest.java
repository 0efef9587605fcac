package com.clubcricket.scorebook.dto;

public class StartInningsRequest {
    private String battingTeam;
    private String bowlingTeam;
    private String strikerName;
    private String nonStrikerName;
    private String bowlerName;

    public StartInningsRequest() {}

    public StartInningsRequest(String battingTeam, String bowlingTeam, String strikerName,
                               String nonStrikerName, String bowlerName) {
        this.battingTeam = battingTeam;
        this.bowlingTeam = bowlingTeam;
        this.strikerName = strikerName;
        this.nonStrikerName = nonStrikerName;
        this.bowlerName = bowlerName;
    }

    public String getBattingTeam() { return battingTeam; }
    public void setBattingTeam(String battingTeam) { this.battingTeam = battingTeam; }

    public String getBowlingTeam() { return bowlingTeam; }
    public void setBowlingTeam(String bowlingTeam) { this.bowlingTeam = bowlingTeam; }

    public String getStrikerName() { return strikerName; }
    public void setStrikerName(String strikerName) { this.strikerName = strikerName; }

    public String getNonStrikerName() { return nonStrikerName; }
    public void setNonStrikerName(String nonStrikerName) { this.nonStrikerName = nonStrikerName; }

    public String getBowlerName() { return bowlerName; }
    public void setBowlerName(String bowlerName) { this.bowlerName = bowlerName; }
}
