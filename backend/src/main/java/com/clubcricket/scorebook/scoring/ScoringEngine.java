package com.clubcricket.scorebook.scoring;

import com.clubcricket.scorebook.config.ScoringLimits;
import com.clubcricket.scorebook.exception.IllegalStateTransitionException;
import com.clubcricket.scorebook.exception.InvalidDeliveryException;
import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.ExtraType;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.InningsStatus;
import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.model.MatchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies deliveries to an innings and reverses them. The engine holds no state and takes no
 * locks; callers serialize mutations of the same innings.
 */
@Component
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    public static final int BALLS_PER_OVER = 6;
    public static final int ALL_OUT_WICKETS = 10;

    private final ScoringLimits limits;

    public ScoringEngine(ScoringLimits limits) {
        this.limits = limits;
    }

    /**
     * Validates and records one delivery, then updates the innings aggregate, strike, and
     * innings/match status. Nothing is modified when validation fails.
     */
    public DeliveryOutcome apply(Match match, Innings innings, Delivery delivery) {
        requireInProgress(innings);
        validate(innings, delivery);

        ExtraType extraType = delivery.extraType();
        boolean legal = extraType.isLegal();
        String striker = innings.getStrikerName();
        String nonStriker = innings.getNonStrikerName();

        BallEvent event = new BallEvent(
                innings.getCurrentOver(), innings.getCurrentBall(),
                innings.getCurrentBowlerName(), striker, nonStriker,
                delivery.runsOffBat(), delivery.four(), delivery.six(),
                extraType, delivery.extraRuns(),
                delivery.wicket(), delivery.dismissalType(),
                trimToNull(delivery.dismissedBatsman()), trimToNull(delivery.fielderName()));
        BallEventLog.of(innings).append(event);

        innings.addRuns(delivery.runsOffBat() + delivery.extraRuns());
        innings.addExtras(extraType, delivery.extraRuns());
        if (delivery.wicket()) {
            innings.setTotalWickets(innings.getTotalWickets() + 1);
        }

        // a wide never changes ends by itself; everything else turns on the runs the batsmen ran
        boolean rotate = extraType != ExtraType.WIDE && delivery.runsOffBat() % 2 == 1;
        boolean overComplete = false;
        if (legal) {
            int ball = innings.getCurrentBall() + 1;
            if (ball >= BALLS_PER_OVER) {
                innings.setCurrentBall(0);
                innings.setCurrentOver(innings.getCurrentOver() + 1);
                overComplete = true;
                rotate = !rotate;
            } else {
                innings.setCurrentBall(ball);
            }
        }
        if (rotate) {
            innings.swapStrike();
        }

        String incoming = trimToNull(delivery.newBatsman());
        if (delivery.wicket() && incoming != null) {
            CreaseEnd dismissedFrom = event.getDismissedBatsman().equals(striker) ? CreaseEnd.STRIKER : CreaseEnd.NON_STRIKER;
            if (CreaseEnd.incomingEnd(dismissedFrom, rotate) == CreaseEnd.STRIKER) {
                innings.setStrikerName(incoming);
            } else {
                innings.setNonStrikerName(incoming);
            }
        }

        boolean inningsEnded = isInningsComplete(match, innings);
        String result = null;
        if (inningsEnded) {
            result = completeInnings(match, innings);
        }
        log.debug("[Scoring][Ball] innings={} seq={} at {} -> {}/{} ({}){}", innings.getInningsNumber(),
                event.getSequenceNumber(), event.getOverBall(), innings.getTotalRuns(), innings.getTotalWickets(),
                innings.getOversDisplay(), inningsEnded ? " innings ended" : "");
        return new DeliveryOutcome(event, overComplete, inningsEnded, result);
    }

    /**
     * Reverses the most recent active delivery exactly and soft-deletes it. Completion of the
     * innings or match is never reopened, so only an innings in progress can be corrected.
     */
    public BallEvent undoLast(Innings innings) {
        requireInProgress(innings);
        BallEvent last = BallEventLog.of(innings).softDelete();

        innings.addRuns(-last.getTotalRuns());
        innings.addExtras(last.getExtraType(), -last.getExtraRuns());
        if (last.isWicket()) {
            innings.setTotalWickets(innings.getTotalWickets() - 1);
        }
        if (last.isLegalDelivery()) {
            if (innings.getCurrentBall() == 0 && innings.getCurrentOver() > 0) {
                innings.setCurrentOver(innings.getCurrentOver() - 1);
                innings.setCurrentBall(BALLS_PER_OVER - 1);
            } else {
                innings.setCurrentBall(innings.getCurrentBall() - 1);
            }
        }
        // the names captured on the event are the crease as it stood before the ball
        innings.setStrikerName(last.getBatsmanName());
        innings.setNonStrikerName(last.getNonStrikerName());
        innings.setCurrentBowlerName(last.getBowlerName());

        log.debug("[Scoring][Undo] innings={} seq={} at {} -> {}/{}", innings.getInningsNumber(),
                last.getSequenceNumber(), last.getOverBall(), innings.getTotalRuns(), innings.getTotalWickets());
        return last;
    }

    /**
     * Marks the innings completed and moves the match on: a break after the first innings, or
     * a completed match with its result after the second.
     *
     * @return the result text when the match is now completed, otherwise null
     */
    public String completeInnings(Match match, Innings innings) {
        innings.setStatus(InningsStatus.COMPLETED);
        if (innings.getInningsNumber() == 1) {
            match.setStatus(MatchStatus.INNINGS_BREAK);
            return null;
        }
        String result = resultText(match, innings);
        match.setStatus(MatchStatus.COMPLETED);
        match.setResultSummary(result);
        return result;
    }

    public String resultText(Match match, Innings secondInnings) {
        Innings first = match.findInnings(1)
                .orElseThrow(() -> new IllegalStateTransitionException("First innings missing for match " + match.getId()));
        Integer target = secondInnings.getTarget();
        if (target != null && secondInnings.getTotalRuns() >= target) {
            int wicketsInHand = ALL_OUT_WICKETS - secondInnings.getTotalWickets();
            return secondInnings.getBattingTeam() + " won by " + wicketsInHand + " wicket(s)";
        }
        int margin = first.getTotalRuns() - secondInnings.getTotalRuns();
        if (margin == 0) {
            return "Match tied";
        }
        return first.getBattingTeam() + " won by " + margin + " run(s)";
    }

    /**
     * Recomputes runs, wickets, extras and the over/ball pointer from the active log. Crease
     * names and status are left alone.
     */
    public RebuildReport rebuild(Innings innings) {
        int runs = innings.getTotalRuns();
        int wickets = innings.getTotalWickets();
        int over = innings.getCurrentOver();
        int ball = innings.getCurrentBall();
        int[] extras = {innings.getExtrasWides(), innings.getExtrasNoBalls(), innings.getExtrasByes(),
                innings.getExtrasLegByes(), innings.getExtrasPenalties()};

        innings.resetAggregates();
        List<BallEvent> active = BallEventLog.of(innings).activeEvents();
        for (BallEvent b : active) {
            innings.addRuns(b.getTotalRuns());
            innings.addExtras(b.getExtraType(), b.getExtraRuns());
            if (b.isWicket()) innings.setTotalWickets(innings.getTotalWickets() + 1);
            if (b.isLegalDelivery()) {
                if (innings.getCurrentBall() + 1 >= BALLS_PER_OVER) {
                    innings.setCurrentBall(0);
                    innings.setCurrentOver(innings.getCurrentOver() + 1);
                } else {
                    innings.setCurrentBall(innings.getCurrentBall() + 1);
                }
            }
        }

        List<String> corrections = new ArrayList<>();
        diff(corrections, "totalRuns", runs, innings.getTotalRuns());
        diff(corrections, "totalWickets", wickets, innings.getTotalWickets());
        diff(corrections, "currentOver", over, innings.getCurrentOver());
        diff(corrections, "currentBall", ball, innings.getCurrentBall());
        diff(corrections, "extrasWides", extras[0], innings.getExtrasWides());
        diff(corrections, "extrasNoBalls", extras[1], innings.getExtrasNoBalls());
        diff(corrections, "extrasByes", extras[2], innings.getExtrasByes());
        diff(corrections, "extrasLegByes", extras[3], innings.getExtrasLegByes());
        diff(corrections, "extrasPenalties", extras[4], innings.getExtrasPenalties());
        if (!corrections.isEmpty()) {
            log.warn("[Scoring][Rebuild] innings={} aggregate drift corrected: {}", innings.getInningsNumber(), corrections);
        }
        return new RebuildReport(innings.getInningsNumber(), active.size(), List.copyOf(corrections));
    }

    private boolean isInningsComplete(Match match, Innings innings) {
        if (innings.getTotalWickets() >= ALL_OUT_WICKETS) return true;
        if (innings.getCurrentOver() >= match.getTotalOvers() && innings.getCurrentBall() == 0) return true;
        return innings.getInningsNumber() == 2
                && innings.getTarget() != null
                && innings.getTotalRuns() >= innings.getTarget();
    }

    private void requireInProgress(Innings innings) {
        if (innings.getStatus() != InningsStatus.IN_PROGRESS) {
            throw new IllegalStateTransitionException("Innings " + innings.getInningsNumber() + " is not in progress.");
        }
        if (isBlank(innings.getStrikerName()) || isBlank(innings.getNonStrikerName()) || isBlank(innings.getCurrentBowlerName())) {
            throw new IllegalStateTransitionException("Striker, non-striker and bowler must be set before scoring.");
        }
    }

    private void validate(Innings innings, Delivery d) {
        int max = limits.getMaxRunsPerBall();
        if (d.runsOffBat() < 0 || d.runsOffBat() > max) {
            throw new InvalidDeliveryException("Runs off the bat must be between 0 and " + max + ".");
        }
        if (d.extraRuns() < 0 || d.extraRuns() > max) {
            throw new InvalidDeliveryException("Extra runs must be between 0 and " + max + ".");
        }
        if (d.extraType() == ExtraType.NONE && d.extraRuns() != 0) {
            throw new InvalidDeliveryException("Extra runs require an extra type.");
        }
        if (d.four() && d.six()) {
            throw new InvalidDeliveryException("Ball cannot be both four and six.");
        }
        if (d.wicket()) {
            if (d.dismissalType() == null) {
                throw new InvalidDeliveryException("Dismissal type is required for a wicket.");
            }
            String dismissed = trimToNull(d.dismissedBatsman());
            if (dismissed == null) {
                throw new InvalidDeliveryException("Dismissed batsman name is required for a wicket.");
            }
            if (!dismissed.equals(innings.getStrikerName()) && !dismissed.equals(innings.getNonStrikerName())) {
                throw new InvalidDeliveryException("Dismissed batsman " + dismissed + " is not at the crease.");
            }
            String incoming = trimToNull(d.newBatsman());
            if (incoming != null && (incoming.equals(innings.getStrikerName()) || incoming.equals(innings.getNonStrikerName()))) {
                throw new InvalidDeliveryException("New batsman " + incoming + " is already at the crease.");
            }
        }
    }

    private static void diff(List<String> out, String field, int cached, int replayed) {
        if (cached != replayed) out.add(field + ": " + cached + " -> " + replayed);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
