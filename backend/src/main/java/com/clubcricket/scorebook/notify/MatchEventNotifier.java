package com.clubcricket.scorebook.notify;

/**
 * Outbound hook for match lifecycle changes (push delivery, live tickers). Only the match
 * lifecycle calls it; the scoring engine never does.
 */
public interface MatchEventNotifier {
    void notify(MatchEvent event);
}
