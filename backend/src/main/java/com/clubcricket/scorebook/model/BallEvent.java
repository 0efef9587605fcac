package com.clubcricket.scorebook.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * One recorded delivery. Rows are never deleted or edited after creation; an undo only flips
 * {@code undone}, so the full log stays available as an audit trail.
 */
@Entity
@Table(name = "ball_events", indexes = {
        @Index(name = "idx_ball_events_innings_seq", columnList = "innings_id, sequence_number")
})
public class BallEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "innings_id", nullable = false, foreignKey = @ForeignKey(name = "fk_ball_event_innings"))
    private Innings innings;

    @Column(name = "sequence_number", nullable = false)
    private int sequenceNumber;

    @Column(name = "over_number", nullable = false)
    private int overNumber;

    @Column(name = "ball_number", nullable = false)
    private int ballNumber;

    @Column(name = "bowler_name", nullable = false, length = 100)
    private String bowlerName;

    @Column(name = "batsman_name", nullable = false, length = 100)
    private String batsmanName;

    @Column(name = "non_striker_name", nullable = false, length = 100)
    private String nonStrikerName;

    @Column(name = "runs_scored", nullable = false)
    private int runsScored;

    @Column(name = "boundary_four", nullable = false)
    private boolean boundaryFour;

    @Column(name = "boundary_six", nullable = false)
    private boolean boundarySix;

    @Enumerated(EnumType.STRING)
    @Column(name = "extra_type", nullable = false, length = 20)
    private ExtraType extraType = ExtraType.NONE;

    @Column(name = "extra_runs", nullable = false)
    private int extraRuns;

    @Column(name = "wicket", nullable = false)
    private boolean wicket;

    @Enumerated(EnumType.STRING)
    @Column(name = "dismissal_type", length = 30)
    private DismissalType dismissalType;

    @Column(name = "dismissed_batsman", length = 100)
    private String dismissedBatsman;

    @Column(name = "fielder_name", length = 100)
    private String fielderName;

    @Column(name = "legal_delivery", nullable = false)
    private boolean legalDelivery = true;

    @Column(name = "undone", nullable = false)
    private boolean undone;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    protected BallEvent() {}

    public BallEvent(int overNumber, int ballNumber,
                     String bowlerName, String batsmanName, String nonStrikerName,
                     int runsScored, boolean boundaryFour, boolean boundarySix,
                     ExtraType extraType, int extraRuns,
                     boolean wicket, DismissalType dismissalType, String dismissedBatsman, String fielderName) {
        this.overNumber = overNumber;
        this.ballNumber = ballNumber;
        this.bowlerName = bowlerName;
        this.batsmanName = batsmanName;
        this.nonStrikerName = nonStrikerName;
        this.runsScored = runsScored;
        this.boundaryFour = boundaryFour;
        this.boundarySix = boundarySix;
        this.extraType = extraType == null ? ExtraType.NONE : extraType;
        this.extraRuns = extraRuns;
        this.wicket = wicket;
        this.dismissalType = dismissalType;
        this.dismissedBatsman = dismissedBatsman;
        this.fielderName = fielderName;
        this.legalDelivery = this.extraType.isLegal();
        this.createdAt = LocalDateTime.now();
    }

    /** Binds a freshly built event to its innings log; an event can only be attached once. */
    public void attach(Innings owner, int sequence) {
        if (this.innings != null) {
            throw new IllegalStateException("Ball event already belongs to innings " + this.innings.getInningsNumber());
        }
        this.innings = owner;
        this.sequenceNumber = sequence;
    }

    public void markUndone() {
        this.undone = true;
    }

    public int getTotalRuns() {
        return runsScored + extraRuns;
    }

    /** Position of the delivery in "over.ball" form as recorded. */
    public String getOverBall() {
        return overNumber + "." + ballNumber;
    }

    @PrePersist
    private void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }

    public Long getId() { return id; }

    public Innings getInnings() { return innings; }

    public int getSequenceNumber() { return sequenceNumber; }

    public int getOverNumber() { return overNumber; }

    public int getBallNumber() { return ballNumber; }

    public String getBowlerName() { return bowlerName; }

    public String getBatsmanName() { return batsmanName; }

    public String getNonStrikerName() { return nonStrikerName; }

    public int getRunsScored() { return runsScored; }

    public boolean isBoundaryFour() { return boundaryFour; }

    public boolean isBoundarySix() { return boundarySix; }

    public ExtraType getExtraType() { return extraType; }

    public int getExtraRuns() { return extraRuns; }

    public boolean isWicket() { return wicket; }

    public DismissalType getDismissalType() { return dismissalType; }

    public String getDismissedBatsman() { return dismissedBatsman; }

    public String getFielderName() { return fielderName; }

    public boolean isLegalDelivery() { return legalDelivery; }

    public boolean isUndone() { return undone; }

    public LocalDateTime getCreatedAt() { return createdAt; }
}
