package com.clubcricket.scorebook.service;

import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.scoring.BallEventLog;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes the complete ball log of an innings as CSV, undone deliveries included, in the order
 * they were recorded. Sequence numbers repeat after an undo, so rows follow the row id.
 */
@Service
public class BallLogCsvExporter {

    static final String[] HEADER = {
            "sequence", "over", "ball", "bowler", "batsman", "non_striker",
            "runs", "four", "six", "extra_type", "extra_runs",
            "wicket", "dismissal", "dismissed_batsman", "fielder",
            "legal", "undone", "recorded_at"
    };

    public String export(Innings innings) {
        StringWriter out = new StringWriter();
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader(HEADER)
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, fmt)) {
            List<BallEvent> events = new ArrayList<>(BallEventLog.of(innings).allEvents());
            // unsaved events have no id yet and keep their list order
            events.sort(Comparator.comparing(BallEvent::getId, Comparator.nullsLast(Comparator.naturalOrder())));
            for (BallEvent b : events) {
                printer.printRecord(
                        b.getSequenceNumber(), b.getOverNumber(), b.getBallNumber(),
                        b.getBowlerName(), b.getBatsmanName(), b.getNonStrikerName(),
                        b.getRunsScored(), b.isBoundaryFour(), b.isBoundarySix(),
                        b.getExtraType(), b.getExtraRuns(),
                        b.isWicket(),
                        b.getDismissalType() == null ? "" : b.getDismissalType().getLabel(),
                        b.getDismissedBatsman(), b.getFielderName(),
                        b.isLegalDelivery(), b.isUndone(), b.getCreatedAt());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ball log for innings " + innings.getInningsNumber(), e);
        }
        return out.toString();
    }
}
