package com.clubcricket.scorebook.dto;

public record ExtrasSummary(int wides, int noBalls, int byes, int legByes, int penalties, int total) {

    public static ExtrasSummary of(int wides, int noBalls, int byes, int legByes, int penalties) {
        return new ExtrasSummary(wides, noBalls, byes, legByes, penalties, wides + noBalls + byes + legByes + penalties);
    }
}
