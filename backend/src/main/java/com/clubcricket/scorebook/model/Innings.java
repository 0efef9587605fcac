package com.clubcricket.scorebook.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cached projection of an innings' active ball log. The aggregate counters are updated
 * incrementally by the scoring engine and can always be rebuilt by replaying {@link #getBalls()}.
 */
@Entity
@Table(name = "innings", uniqueConstraints = {
        @UniqueConstraint(name = "uk_innings_match_number", columnNames = {"match_id", "innings_number"})
})
public class Innings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "match_id", nullable = false, foreignKey = @ForeignKey(name = "fk_innings_match"))
    private Match match;

    @Column(name = "innings_number", nullable = false)
    private int inningsNumber;

    @Column(name = "batting_team", nullable = false, length = 100)
    private String battingTeam;

    @Column(name = "bowling_team", nullable = false, length = 100)
    private String bowlingTeam;

    @Column(name = "total_runs", nullable = false)
    private int totalRuns;

    @Column(name = "total_wickets", nullable = false)
    private int totalWickets;

    @Column(name = "current_over", nullable = false)
    private int currentOver;

    @Column(name = "current_ball", nullable = false)
    private int currentBall;

    @Column(name = "extras_wides", nullable = false)
    private int extrasWides;

    @Column(name = "extras_no_balls", nullable = false)
    private int extrasNoBalls;

    @Column(name = "extras_byes", nullable = false)
    private int extrasByes;

    @Column(name = "extras_leg_byes", nullable = false)
    private int extrasLegByes;

    @Column(name = "extras_penalties", nullable = false)
    private int extrasPenalties;

    @Column(name = "target")
    private Integer target;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private InningsStatus status = InningsStatus.NOT_STARTED;

    @Column(name = "striker_name", length = 100)
    private String strikerName;

    @Column(name = "non_striker_name", length = 100)
    private String nonStrikerName;

    @Column(name = "current_bowler_name", length = 100)
    private String currentBowlerName;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "innings", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sequenceNumber ASC, id ASC")
    private List<BallEvent> balls = new ArrayList<>();

    public Innings() {}

    public Innings(int inningsNumber, String battingTeam, String bowlingTeam,
                   String strikerName, String nonStrikerName, String currentBowlerName) {
        this.inningsNumber = inningsNumber;
        this.battingTeam = battingTeam;
        this.bowlingTeam = bowlingTeam;
        this.strikerName = strikerName;
        this.nonStrikerName = nonStrikerName;
        this.currentBowlerName = currentBowlerName;
    }

    @PrePersist
    private void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }

    public void addRuns(int runs) {
        this.totalRuns += runs;
    }

    /** Routes extra runs into the counter matching the extra type; NONE is ignored. */
    public void addExtras(ExtraType type, int runs) {
        switch (type) {
            case WIDE -> extrasWides += runs;
            case NO_BALL -> extrasNoBalls += runs;
            case BYE -> extrasByes += runs;
            case LEG_BYE -> extrasLegByes += runs;
            case PENALTY -> extrasPenalties += runs;
            case NONE -> { }
        }
    }

    public int getExtrasTotal() {
        return extrasWides + extrasNoBalls + extrasByes + extrasLegByes + extrasPenalties;
    }

    public void swapStrike() {
        String previousStriker = strikerName;
        strikerName = nonStrikerName;
        nonStrikerName = previousStriker;
    }

    /** Overs in cricket notation, e.g. "12.3", or "12" on an over boundary. */
    public String getOversDisplay() {
        return currentBall == 0 ? String.valueOf(currentOver) : currentOver + "." + currentBall;
    }

    public void resetAggregates() {
        totalRuns = 0;
        totalWickets = 0;
        currentOver = 0;
        currentBall = 0;
        extrasWides = 0;
        extrasNoBalls = 0;
        extrasByes = 0;
        extrasLegByes = 0;
        extrasPenalties = 0;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Match getMatch() { return match; }
    public void setMatch(Match match) { this.match = match; }

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

    public int getCurrentOver() { return currentOver; }
    public void setCurrentOver(int currentOver) { this.currentOver = currentOver; }

    public int getCurrentBall() { return currentBall; }
    public void setCurrentBall(int currentBall) { this.currentBall = currentBall; }

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

    public Integer getTarget() { return target; }
    public void setTarget(Integer target) { this.target = target; }

    public InningsStatus getStatus() { return status; }
    public void setStatus(InningsStatus status) { this.status = status; }

    public String getStrikerName() { return strikerName; }
    public void setStrikerName(String strikerName) { this.strikerName = strikerName; }

    public String getNonStrikerName() { return nonStrikerName; }
    public void setNonStrikerName(String nonStrikerName) { this.nonStrikerName = nonStrikerName; }

    public String getCurrentBowlerName() { return currentBowlerName; }
    public void setCurrentBowlerName(String currentBowlerName) { this.currentBowlerName = currentBowlerName; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public List<BallEvent> getBalls() { return balls; }
    public void setBalls(List<BallEvent> balls) { this.balls = balls; }
}
