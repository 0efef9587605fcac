package com.clubcricket.scorebook.dto;

public class ChangeBowlerRequest {
    private String bowlerName;

    public ChangeBowlerRequest() {}

    public ChangeBowlerRequest(String bowlerName) {
        this.bowlerName = bowlerName;
    }

    public String getBowlerName() { return bowlerName; }
    public void setBowlerName(String bowlerName) { this.bowlerName = bowlerName; }
}
