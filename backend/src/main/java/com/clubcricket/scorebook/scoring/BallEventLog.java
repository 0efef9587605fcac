package com.clubcricket.scorebook.scoring;

import com.clubcricket.scorebook.exception.NothingToUndoException;
import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.Innings;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only view over one innings' ball events. Events are kept in recording order and are
 * only ever soft-deleted.
 */
public final class BallEventLog {

    private final Innings innings;

    private BallEventLog(Innings innings) {
        this.innings = innings;
    }

    public static BallEventLog of(Innings innings) {
        return new BallEventLog(innings);
    }

    /**
     * Stores the event and gives it the next sequence number: the count of active events plus
     * one. Numbers already held by undone events are left as they are.
     */
    public BallEvent append(BallEvent event) {
        event.attach(innings, (int) activeCount() + 1);
        innings.getBalls().add(event);
        return event;
    }

    /** Fresh stream of the active events in recording order; each call starts over. */
    public Stream<BallEvent> active() {
        return innings.getBalls().stream().filter(b -> !b.isUndone());
    }

    public List<BallEvent> activeEvents() {
        return active().collect(Collectors.toUnmodifiableList());
    }

    public long activeCount() {
        return active().count();
    }

    public Optional<BallEvent> lastActive() {
        List<BallEvent> balls = innings.getBalls();
        for (int i = balls.size() - 1; i >= 0; i--) {
            if (!balls.get(i).isUndone()) return Optional.of(balls.get(i));
        }
        return Optional.empty();
    }

    /** Marks the most recent active event as undone and returns it. */
    public BallEvent softDelete() {
        BallEvent last = lastActive()
                .orElseThrow(() -> new NothingToUndoException("No balls to undo."));
        last.markUndone();
        return last;
    }

    /** Every recorded event, undone ones included. */
    public List<BallEvent> allEvents() {
        return Collections.unmodifiableList(innings.getBalls());
    }
}
