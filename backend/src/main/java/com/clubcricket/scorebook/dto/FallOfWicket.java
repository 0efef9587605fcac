package com.clubcricket.scorebook.dto;

/**
 * @param score innings total at the moment the wicket fell
 * @param over  "over.ball" of the dismissal as recorded
 */
public record FallOfWicket(int wicketNumber, String batsman, int score, String over) {}
