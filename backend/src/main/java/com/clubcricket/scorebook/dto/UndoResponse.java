package com.clubcricket.scorebook.dto;

public record UndoResponse(String message, BallEventResponse undone, MatchResponse match) {}
