package com.clubcricket.scorebook.dto;

import java.util.ArrayList;
import java.util.List;

public class InningsScorecard {
    private int inningsNumber;
    private String battingTeam;
    private String bowlingTeam;
    private int totalRuns;
    private int totalWickets;
    private String totalOvers;
    private Integer target;
    private ExtrasSummary extras;
    private List<BatsmanStats> batsmen = new ArrayList<>();
    private List<BowlerStats> bowlers = new ArrayList<>();
    private List<FallOfWicket> fallOfWickets = new ArrayList<>();

    public InningsScorecard() {}

    public int getInningsNumber() { return inningsNumber; }
    public void setInningsNumber(int inningsNumber) { this.inningsNumber = inningsNumber; }

    public String getBattingTeam() { return battingTeam; }
    public void setBattingTeam(String battingTeam) { this.battingTeam = battingTeam; }

    public String getBowlingTeam() { return bowlingTeam; }
    public void setBowlingTeam(String bowlingTeam) { this.bowlingTeam = bowlingTeam; }

    public int getTotalRuns() { return totalRuns; }
    public void setTotalRuns(int totalRuns) { this.totalRuns = totalRuns; }

    public int getTotalWickets() { return totalWickets; }
    public void setTotalWickets(int totalWickets) { this.totalWickets = totalWickets; }

    public String getTotalOvers() { return totalOvers; }
    public void setTotalOvers(String totalOvers) { this.totalOvers = totalOvers; }

    public Integer getTarget() { return target; }
    public void setTarget(Integer target) { this.target = target; }

    public ExtrasSummary getExtras() { return extras; }
    public void setExtras(ExtrasSummary extras) { this.extras = extras; }

    public List<BatsmanStats> getBatsmen() { return batsmen; }
    public void setBatsmen(List<BatsmanStats> batsmen) { this.batsmen = batsmen; }

    public List<BowlerStats> getBowlers() { return bowlers; }
    public void setBowlers(List<BowlerStats> bowlers) { this.bowlers = bowlers; }

    public List<FallOfWicket> getFallOfWickets() { return fallOfWickets; }
    public void setFallOfWickets(List<FallOfWicket> fallOfWickets) { this.fallOfWickets = fallOfWickets; }
}
