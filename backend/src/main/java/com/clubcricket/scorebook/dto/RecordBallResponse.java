package com.clubcricket.scorebook.dto;

public record RecordBallResponse(boolean overComplete,
                                 boolean inningsEnded,
                                 String resultSummary,
                                 MatchResponse match) {}
