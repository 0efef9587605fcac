package com.clubcricket.scorebook.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "scoring_audit", indexes = {
        @Index(name = "idx_scoring_audit_recorded_at", columnList = "recorded_at"),
        @Index(name = "idx_scoring_audit_match", columnList = "match_id")
})
public class ScoringAudit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "action", length = 64, nullable = false)
    private String action;

    // plain id rather than an association: the audit row outlives a deleted match
    @Column(name = "match_id", nullable = false)
    private Long matchId;

    @Column(name = "params", length = 1000)
    private String params;

    public ScoringAudit() {}

    public ScoringAudit(String action, Long matchId, String params) {
        this.action = action;
        this.matchId = matchId;
        this.params = params;
    }

    @PrePersist
    public void prePersist() {
        if (timestamp == null) timestamp = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public Long getMatchId() { return matchId; }
    public void setMatchId(Long matchId) { this.matchId = matchId; }

    public String getParams() { return params; }
    public void setParams(String params) { this.params = params; }
}
