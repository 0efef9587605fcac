package com.clubcricket.scorebook.dto;

import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.InningsStatus;

import java.util.ArrayList;
import java.util.List;

public class InningsResponse {
    private Long id;
    private int inningsNumber;
    private String battingTeam;
    private String bowlingTeam;
    private int totalRuns;
    private int totalWickets;
    private String oversBowled;
    private int extrasWides;
    private int extrasNoBalls;
    private int extrasByes;
    private int extrasLegByes;
    private int extrasPenalties;
    private int extrasTotal;
    private Integer target;
    private InningsStatus status;
    private int currentOver;
    private int currentBall;
    private String strikerName;
    private String nonStrikerName;
    private String currentBowlerName;
    // active deliveries only; undone ones are kept for the ball log export
    private List<BallEventResponse> balls = new ArrayList<>();

    public InningsResponse() {}

    public static InningsResponse from(Innings inn) {
        InningsResponse r = new InningsResponse();
        r.id = inn.getId();
        r.inningsNumber = inn.getInningsNumber();
        r.battingTeam = inn.getBattingTeam();
        r.bowlingTeam = inn.getBowlingTeam();
        r.totalRuns = inn.getTotalRuns();
        r.totalWickets = inn.getTotalWickets();
        r.oversBowled = inn.getOversDisplay();
        r.extrasWides = inn.getExtrasWides();
        r.extrasNoBalls = inn.getExtrasNoBalls();
        r.extrasByes = inn.getExtrasByes();
        r.extrasLegByes = inn.getExtrasLegByes();
        r.extrasPenalties = inn.getExtrasPenalties();
        r.extrasTotal = inn.getExtrasTotal();
        r.target = inn.getTarget();
        r.status = inn.getStatus();
        r.currentOver = inn.getCurrentOver();
        r.currentBall = inn.getCurrentBall();
        r.strikerName = inn.getStrikerName();
        r.nonStrikerName = inn.getNonStrikerName();
        r.currentBowlerName = inn.getCurrentBowlerName();
        r.balls = inn.getBalls().stream()
                .filter(b -> !b.isUndone())
                .map(BallEventResponse::from)
                .toList();
        return r;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

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

    public String getOversBowled() { return oversBowled; }
    public void setOversBowled(String oversBowled) { this.oversBowled = oversBowled; }

    public int getExtrasWides() { return extrasWides; }
    public void setExtrasWides(int extrasWides) { this.extrasWides = extrasWides; }

    public int getExtrasNoBalls() { return extrasNoBalls; }
    public void setExtrasNoBalls(int extrasNoBalls) { this.extrasNoBalls = extrasNoBalls; }

    public int getExtrasByes() { return extrasByes; }
    public void setExtrasByes(int extrasByes) { this.extrasByes = extrasByes; }

    public int getExtrasLegByes() { return extrasLegByes; }
    public void setExtrasLegByes(int extrasLegByes) { this.extrasLegByes = extrasLegByes; }

    public int getExtrasPenalties() { return extrasPenalties; }
    public void setExtrasPenalties(int extrasPenalties) { this.extrasPenalties = extrasPenalties; }

    public int getExtrasTotal() { return extrasTotal; }
    public void setExtrasTotal(int extrasTotal) { this.extrasTotal = extrasTotal; }

    public Integer getTarget() { return target; }
    public void setTarget(Integer target) { this.target = target; }

    public InningsStatus getStatus() { return status; }
    public void setStatus(InningsStatus status) { this.status = status; }

    public int getCurrentOver() { return currentOver; }
    public void setCurrentOver(int currentOver) { this.currentOver = currentOver; }

    public int getCurrentBall() { return currentBall; }
    public void setCurrentBall(int currentBall) { this.currentBall = currentBall; }

    public String getStrikerName() { return strikerName; }
    public void setStrikerName(String strikerName) { this.strikerName = strikerName; }

    public String getNonStrikerName() { return nonStrikerName; }
    public void setNonStrikerName(String nonStrikerName) { this.nonStrikerName = nonStrikerName; }

    public String getCurrentBowlerName() { return currentBowlerName; }
    public void setCurrentBowlerName(String currentBowlerName) { this.currentBowlerName = currentBowlerName; }

    public List<BallEventResponse> getBalls() { return balls; }
    public void setBalls(List<BallEventResponse> balls) { this.balls = balls; }
}
