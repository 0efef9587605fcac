package com.clubcricket.scorebook.dto;

public class BowlerStats {
    private String name;
    private String overs; // "3.4" or "4"
    private int maidens;
    private int runsConceded;
    private int wickets;
    private double economy;
    private int wides;
    private int noBalls;

    public BowlerStats() {}

    public BowlerStats(String name, String overs, int maidens, int runsConceded, int wickets,
                       double economy, int wides, int noBalls) {
        this.name = name;
        this.overs = overs;
        this.maidens = maidens;
        this.runsConceded = runsConceded;
        this.wickets = wickets;
        this.economy = economy;
        this.wides = wides;
        this.noBalls = noBalls;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getOvers() { return overs; }
    public void setOvers(String overs) { this.overs = overs; }

    public int getMaidens() { return maidens; }
    public void setMaidens(int maidens) { this.maidens = maidens; }

    public int getRunsConceded() { return runsConceded; }
    public void setRunsConceded(int runsConceded) { this.runsConceded = runsConceded; }

    public int getWickets() { return wickets; }
    public void setWickets(int wickets) { this.wickets = wickets; }

    public double getEconomy() { return economy; }
    public void setEconomy(double economy) { this.economy = economy; }

    public int getWides() { return wides; }
    public void setWides(int wides) { this.wides = wides; }

    public int getNoBalls() { return noBalls; }
    public void setNoBalls(int noBalls) { this.noBalls = noBalls; }
}
