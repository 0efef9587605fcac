package com.clubcricket.scorebook.scoring;

import com.clubcricket.scorebook.config.ScoringLimits;
import com.clubcricket.scorebook.dto.BatsmanStats;
import com.clubcricket.scorebook.dto.BowlerStats;
import com.clubcricket.scorebook.dto.FullScorecard;
import com.clubcricket.scorebook.dto.InningsScorecard;
import com.clubcricket.scorebook.model.DismissalType;
import com.clubcricket.scorebook.model.ExtraType;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.InningsStatus;
import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.model.MatchStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScorecardDeriverTest {

    private final ScoringEngine engine = new ScoringEngine(new ScoringLimits(50, 7));
    private final ScorecardDeriver deriver = new ScorecardDeriver();
    private Match match;
    private Innings innings;

    @BeforeEach
    void setUp() {
        match = new Match("Lions", "Tigers", 20, null);
        match.setStatus(MatchStatus.IN_PROGRESS);
        innings = new Innings(1, "Lions", "Tigers", "Ann", "Ben", "Zed");
        innings.setStatus(InningsStatus.IN_PROGRESS);
        match.addInnings(innings);
    }

    @Test
    void fourAndSixGiveBatsmanTenAndWideGoesToExtras() {
        engine.apply(match, innings, Delivery.boundaryFour());
        engine.apply(match, innings, Delivery.boundarySix());
        engine.apply(match, innings, Delivery.extra(ExtraType.WIDE, 1));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getTotalRuns()).isEqualTo(11);
        BatsmanStats ann = card.getBatsmen().get(0);
        assertThat(ann.getName()).isEqualTo("Ann");
        assertThat(ann.getRuns()).isEqualTo(10);
        assertThat(ann.getBallsFaced()).isEqualTo(2);
        assertThat(ann.getFours()).isEqualTo(1);
        assertThat(ann.getSixes()).isEqualTo(1);
        assertThat(ann.getStrikeRate()).isEqualTo(500.0);
        assertThat(ann.getHowOut()).isEqualTo("not out");
        assertThat(card.getExtras().wides()).isEqualTo(1);
        assertThat(card.getExtras().total()).isEqualTo(1);

        BowlerStats zed = card.getBowlers().get(0);
        assertThat(zed.getRunsConceded()).isEqualTo(11);
        assertThat(zed.getWides()).isEqualTo(1);
        assertThat(zed.getOvers()).isEqualTo("0.2");
    }

    @Test
    void batsmanYetToFaceIsListedAfterThoseWhoHave() {
        engine.apply(match, innings, Delivery.runs(0));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getBatsmen()).extracting(BatsmanStats::getName).containsExactly("Ann", "Ben");
        assertThat(card.getBatsmen().get(1).getBallsFaced()).isZero();
    }

    @Test
    void undoneDeliveriesAreIgnored() {
        engine.apply(match, innings, Delivery.boundarySix());
        engine.undoLast(innings);
        engine.apply(match, innings, Delivery.runs(1));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getBatsmen().get(0).getRuns()).isEqualTo(1);
        assertThat(card.getBatsmen().get(0).getSixes()).isZero();
        assertThat(card.getBowlers().get(0).getRunsConceded()).isEqualTo(1);
    }

    @Test
    void dismissalsAreDescribedAndCreditedToBowler() {
        engine.apply(match, innings, Delivery.wicket(DismissalType.CAUGHT, "Ann", "Fi", "Cal"));
        engine.apply(match, innings, Delivery.runs(1));
        engine.apply(match, innings, Delivery.runOut(1, "Ben", "Gus", "Dee"));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getBatsmen()).extracting(BatsmanStats::getName).containsExactly("Ann", "Cal", "Ben", "Dee");
        assertThat(card.getBatsmen().get(0).getHowOut()).isEqualTo("c Fi b Zed");
        assertThat(card.getBatsmen().get(2).getHowOut()).isEqualTo("run out (Gus)");
        assertThat(card.getBowlers().get(0).getWickets()).isEqualTo(1);
        assertThat(card.getFallOfWickets()).hasSize(2);
        assertThat(card.getFallOfWickets().get(0).score()).isZero();
        assertThat(card.getFallOfWickets().get(1).wicketNumber()).isEqualTo(2);
        assertThat(card.getFallOfWickets().get(1).score()).isEqualTo(2);
        assertThat(card.getFallOfWickets().get(1).over()).isEqualTo("0.2");
    }

    @Test
    void dismissalTextVariants() {
        engine.apply(match, innings, Delivery.wicket(DismissalType.BOWLED, "Ann", null, "Cal"));
        engine.apply(match, innings, Delivery.wicket(DismissalType.CAUGHT, "Cal", null, "Dee"));
        engine.apply(match, innings, Delivery.wicket(DismissalType.LBW, "Dee", null, "Eve"));
        engine.apply(match, innings, Delivery.wicket(DismissalType.STUMPED, "Eve", "Kip", "Fay"));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getBatsmen()).extracting(BatsmanStats::getHowOut)
                .containsExactly("b Zed", "c & b Zed", "lbw b Zed", "st Kip b Zed", "not out", "not out");
        assertThat(card.getBowlers().get(0).getWickets()).isEqualTo(4);
    }

    @Test
    void stumpingWithoutKeeperNamedFallsBackToLabel() {
        engine.apply(match, innings, Delivery.wicket(DismissalType.STUMPED, "Ann", null, "Cal"));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getBatsmen().get(0).getHowOut()).isEqualTo("stumped");
        assertThat(card.getBowlers().get(0).getWickets()).isEqualTo(1);
    }

    @Test
    void timedOutAndHandledTheBallCountForBowler() {
        engine.apply(match, innings, Delivery.wicket(DismissalType.TIMED_OUT, "Ann", null, "Cal"));
        engine.apply(match, innings, Delivery.wicket(DismissalType.HANDLED_THE_BALL, "Cal", null, "Dee"));
        engine.apply(match, innings, Delivery.wicket(DismissalType.RETIRED_HURT, "Dee", null, "Eve"));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getBatsmen()).extracting(BatsmanStats::getHowOut)
                .startsWith("timed out", "handled the ball", "retired hurt");
        assertThat(card.getBowlers().get(0).getWickets()).isEqualTo(2);
    }

    @Test
    void maidenNeedsSixLegalBallsWithoutConcededRuns() {
        for (int i = 0; i < 5; i++) engine.apply(match, innings, Delivery.runs(0));
        engine.apply(match, innings, Delivery.extra(ExtraType.LEG_BYE, 1));
        innings.setCurrentBowlerName("Yan");
        engine.apply(match, innings, Delivery.runs(0));
        engine.apply(match, innings, Delivery.extra(ExtraType.WIDE, 1));
        for (int i = 0; i < 5; i++) engine.apply(match, innings, Delivery.runs(0));

        InningsScorecard card = deriver.derive(innings);

        BowlerStats zed = card.getBowlers().get(0);
        BowlerStats yan = card.getBowlers().get(1);
        assertThat(zed.getMaidens()).isEqualTo(1);
        assertThat(zed.getOvers()).isEqualTo("1");
        assertThat(zed.getEconomy()).isEqualTo(0.0);
        assertThat(yan.getMaidens()).isZero();
        assertThat(yan.getRunsConceded()).isEqualTo(1);
        assertThat(card.getExtras().legByes()).isEqualTo(1);
        assertThat(card.getExtras().total()).isEqualTo(2);
    }

    @Test
    void noBallCountsAsBallFacedButNotForBowlerOvers() {
        engine.apply(match, innings, Delivery.noBall(2, 1));

        InningsScorecard card = deriver.derive(innings);

        assertThat(card.getBatsmen().get(0).getBallsFaced()).isEqualTo(1);
        assertThat(card.getBatsmen().get(0).getRuns()).isEqualTo(2);
        assertThat(card.getBowlers().get(0).getOvers()).isEqualTo("0");
        assertThat(card.getBowlers().get(0).getRunsConceded()).isEqualTo(3);
        assertThat(card.getBowlers().get(0).getNoBalls()).isEqualTo(1);
    }

    @Test
    void fullScorecardCoversEveryInnings() {
        engine.apply(match, innings, Delivery.runs(3));

        FullScorecard full = deriver.derive(match);

        assertThat(full.innings()).hasSize(1);
        assertThat(full.match().getTeamAName()).isEqualTo("Lions");
        assertThat(full.innings().get(0).getTotalOvers()).isEqualTo("0.1");
    }
}
