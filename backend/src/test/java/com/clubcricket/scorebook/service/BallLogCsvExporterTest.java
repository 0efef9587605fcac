package com.clubcricket.scorebook.service;

import com.clubcricket.scorebook.config.ScoringLimits;
import com.clubcricket.scorebook.model.DismissalType;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.InningsStatus;
import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.scoring.Delivery;
import com.clubcricket.scorebook.scoring.ScoringEngine;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BallLogCsvExporterTest {

    @Test
    void exportsEveryEventIncludingUndone() throws Exception {
        ScoringEngine engine = new ScoringEngine(new ScoringLimits(50, 7));
        Match match = new Match("Lions", "Tigers", 20, null);
        Innings innings = new Innings(1, "Lions", "Tigers", "Ann", "Ben", "Zed");
        innings.setStatus(InningsStatus.IN_PROGRESS);
        match.addInnings(innings);
        engine.apply(match, innings, Delivery.boundaryFour());
        engine.apply(match, innings, Delivery.wicket(DismissalType.CAUGHT, "Ann", "Fi", "Cal"));
        engine.undoLast(innings);

        String csv = new BallLogCsvExporter().export(innings);

        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (CSVParser parser = new CSVParser(new StringReader(csv), fmt)) {
            assertThat(parser.getHeaderNames()).containsExactly(BallLogCsvExporter.HEADER);
            List<CSVRecord> rows = parser.getRecords();
            assertThat(rows).hasSize(2);
            assertThat(rows.get(0).get("runs")).isEqualTo("4");
            assertThat(rows.get(0).get("four")).isEqualTo("true");
            assertThat(rows.get(0).get("undone")).isEqualTo("false");
            assertThat(rows.get(1).get("dismissal")).isEqualTo("caught");
            assertThat(rows.get(1).get("fielder")).isEqualTo("Fi");
            assertThat(rows.get(1).get("undone")).isEqualTo("true");
        }
    }
}
