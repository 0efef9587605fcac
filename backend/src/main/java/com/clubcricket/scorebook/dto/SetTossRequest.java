package com.clubcricket.scorebook.dto;

import com.clubcricket.scorebook.model.TossDecision;

public class SetTossRequest {
    private String tossWinner;
    private TossDecision tossDecision;

    public SetTossRequest() {}

    public SetTossRequest(String tossWinner, TossDecision tossDecision) {
        this.tossWinner = tossWinner;
        this.tossDecision = tossDecision;
    }

    public String getTossWinner() { return tossWinner; }
    public void setTossWinner(String tossWinner) { this.tossWinner = tossWinner; }

    public TossDecision getTossDecision() { return tossDecision; }
    public void setTossDecision(TossDecision tossDecision) { this.tossDecision = tossDecision; }
}
