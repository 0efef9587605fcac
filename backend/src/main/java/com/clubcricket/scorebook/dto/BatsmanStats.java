package com.clubcricket.scorebook.dto;

public class BatsmanStats {
    private String name;
    private int runs;
    private int ballsFaced;
    private int fours;
    private int sixes;
    private double strikeRate;
    private String howOut;
    private String bowler; // null while not out

    public BatsmanStats() {}

    public BatsmanStats(String name, int runs, int ballsFaced, int fours, int sixes,
                        double strikeRate, String howOut, String bowler) {
        this.name = name;
        this.runs = runs;
        this.ballsFaced = ballsFaced;
        this.fours = fours;
        this.sixes = sixes;
        this.strikeRate = strikeRate;
        this.howOut = howOut;
        this.bowler = bowler;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getRuns() { return runs; }
    public void setRuns(int runs) { this.runs = runs; }

    public int getBallsFaced() { return ballsFaced; }
    public void setBallsFaced(int ballsFaced) { this.ballsFaced = ballsFaced; }

    public int getFours() { return fours; }
    public void setFours(int fours) { this.fours = fours; }

    public int getSixes() { return sixes; }
    public void setSixes(int sixes) { this.sixes = sixes; }

    public double getStrikeRate() { return strikeRate; }
    public void setStrikeRate(double strikeRate) { this.strikeRate = strikeRate; }

    public String getHowOut() { return howOut; }
    public void setHowOut(String howOut) { this.howOut = howOut; }

    public String getBowler() { return bowler; }
    public void setBowler(String bowler) { this.bowler = bowler; }
}
