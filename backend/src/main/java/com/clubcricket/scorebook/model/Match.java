package com.clubcricket.scorebook.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "matches", indexes = {
        @Index(name = "idx_matches_created_at", columnList = "created_at")
})
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_a_name", nullable = false, length = 100)
    private String teamAName;

    @Column(name = "team_b_name", nullable = false, length = 100)
    private String teamBName;

    @Column(name = "total_overs", nullable = false)
    private Integer totalOvers;

    @Column(name = "venue", length = 200)
    private String venue;

    @Column(name = "toss_winner", length = 100)
    private String tossWinner;

    @Enumerated(EnumType.STRING)
    @Column(name = "toss_decision", length = 10)
    private TossDecision tossDecision;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MatchStatus status = MatchStatus.TOSS;

    @Column(name = "result_summary")
    private String resultSummary;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("inningsNumber ASC")
    private List<Innings> innings = new ArrayList<>();

    public Match() {}

    public Match(String teamAName, String teamBName, Integer totalOvers, String venue) {
        this.teamAName = teamAName;
        this.teamBName = teamBName;
        this.totalOvers = totalOvers;
        this.venue = venue;
        this.status = MatchStatus.TOSS;
    }

    @PrePersist
    private void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    private void preUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isParticipant(String teamName) {
        return teamName != null && (teamName.equals(teamAName) || teamName.equals(teamBName));
    }

    public Optional<Innings> findInnings(int inningsNumber) {
        return innings.stream().filter(i -> i.getInningsNumber() == inningsNumber).findFirst();
    }

    public Optional<Innings> findActiveInnings() {
        return innings.stream().filter(i -> i.getStatus() == InningsStatus.IN_PROGRESS).findFirst();
    }

    public void addInnings(Innings inn) {
        inn.setMatch(this);
        innings.add(inn);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getTeamAName() { return teamAName; }
    public void setTeamAName(String teamAName) { this.teamAName = teamAName; }

    public String getTeamBName() { return teamBName; }
    public void setTeamBName(String teamBName) { this.teamBName = teamBName; }

    public Integer getTotalOvers() { return totalOvers; }
    public void setTotalOvers(Integer totalOvers) { this.totalOvers = totalOvers; }

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

    public List<Innings> getInnings() { return innings; }
    public void setInnings(List<Innings> innings) { this.innings = innings; }
}
