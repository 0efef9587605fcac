package com.clubcricket.scorebook.dto;

import com.clubcricket.scorebook.model.DismissalType;
import com.clubcricket.scorebook.model.ExtraType;
import com.clubcricket.scorebook.scoring.Delivery;

public class RecordBallRequest {
    private int runsScored;
    private boolean boundaryFour;
    private boolean boundarySix;
    private ExtraType extraType = ExtraType.NONE;
    private int extraRuns;
    private boolean wicket;
    private DismissalType dismissalType;
    private String dismissedBatsman;
    private String fielderName;
    // who walks in after a wicket; optional
    private String newBatsmanName;

    public RecordBallRequest() {}

    public Delivery toDelivery() {
        return new Delivery(runsScored, boundaryFour, boundarySix, extraType, extraRuns,
                wicket, dismissalType, dismissedBatsman, fielderName, newBatsmanName);
    }

    public int getRunsScored() { return runsScored; }
    public void setRunsScored(int runsScored) { this.runsScored = runsScored; }

    public boolean isBoundaryFour() { return boundaryFour; }
    public void setBoundaryFour(boolean boundaryFour) { this.boundaryFour = boundaryFour; }

    public boolean isBoundarySix() { return boundarySix; }
    public void setBoundarySix(boolean boundarySix) { this.boundarySix = boundarySix; }

    public ExtraType getExtraType() { return extraType; }
    public void setExtraType(ExtraType extraType) { this.extraType = extraType; }

    public int getExtraRuns() { return extraRuns; }
    public void setExtraRuns(int extraRuns) { this.extraRuns = extraRuns; }

    public boolean isWicket() { return wicket; }
    public void setWicket(boolean wicket) { this.wicket = wicket; }

    public DismissalType getDismissalType() { return dismissalType; }
    public void setDismissalType(DismissalType dismissalType) { this.dismissalType = dismissalType; }

    public String getDismissedBatsman() { return dismissedBatsman; }
    public void setDismissedBatsman(String dismissedBatsman) { this.dismissedBatsman = dismissedBatsman; }

    public String getFielderName() { return fielderName; }
    public void setFielderName(String fielderName) { this.fielderName = fielderName; }

    public String getNewBatsmanName() { return newBatsmanName; }
    public void setNewBatsmanName(String newBatsmanName) { this.newBatsmanName = newBatsmanName; }
}
