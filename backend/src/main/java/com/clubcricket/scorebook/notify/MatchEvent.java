package com.clubcricket.scorebook.notify;

public record MatchEvent(Long matchId, Type type, Integer inningsNumber, String summary) {

    public enum Type {
        INNINGS_STARTED,
        INNINGS_COMPLETED,
        MATCH_COMPLETED,
        MATCH_ABANDONED
    }
}
