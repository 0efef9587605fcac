package com.clubcricket.scorebook.dto;

import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.DismissalType;
import com.clubcricket.scorebook.model.ExtraType;

import java.time.LocalDateTime;

public record BallEventResponse(Long id,
                                int sequenceNumber,
                                int overNumber,
                                int ballNumber,
                                String bowlerName,
                                String batsmanName,
                                String nonStrikerName,
                                int runsScored,
                                boolean boundaryFour,
                                boolean boundarySix,
                                ExtraType extraType,
                                int extraRuns,
                                boolean wicket,
                                DismissalType dismissalType,
                                String dismissedBatsman,
                                String fielderName,
                                boolean legalDelivery,
                                LocalDateTime createdAt) {

    public static BallEventResponse from(BallEvent b) {
        return new BallEventResponse(b.getId(), b.getSequenceNumber(), b.getOverNumber(), b.getBallNumber(),
                b.getBowlerName(), b.getBatsmanName(), b.getNonStrikerName(),
                b.getRunsScored(), b.isBoundaryFour(), b.isBoundarySix(),
                b.getExtraType(), b.getExtraRuns(),
                b.isWicket(), b.getDismissalType(), b.getDismissedBatsman(), b.getFielderName(),
                b.isLegalDelivery(), b.getCreatedAt());
    }
}
