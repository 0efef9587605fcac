package com.clubcricket.scorebook.scoring;

import com.clubcricket.scorebook.dto.BatsmanStats;
import com.clubcricket.scorebook.dto.BowlerStats;
import com.clubcricket.scorebook.dto.ExtrasSummary;
import com.clubcricket.scorebook.dto.FallOfWicket;
import com.clubcricket.scorebook.dto.FullScorecard;
import com.clubcricket.scorebook.dto.InningsScorecard;
import com.clubcricket.scorebook.dto.MatchListItem;
import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.DismissalType;
import com.clubcricket.scorebook.model.ExtraType;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.Match;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds scorecards by folding over the active ball log. Read-only: neither the innings nor its
 * events are modified. Players are listed in the order they first appear in the log.
 */
@Component
public class ScorecardDeriver {

    public FullScorecard derive(Match match) {
        List<InningsScorecard> cards = new ArrayList<>();
        for (Innings inn : match.getInnings()) {
            cards.add(derive(inn));
        }
        return new FullScorecard(MatchListItem.from(match), cards);
    }

    public InningsScorecard derive(Innings innings) {
        Map<String, BattingLine> batting = new LinkedHashMap<>();
        Map<String, BowlingFigures> bowling = new LinkedHashMap<>();
        List<FallOfWicket> fallOfWickets = new ArrayList<>();
        int wides = 0, noBalls = 0, byes = 0, legByes = 0, penalties = 0;
        int runningScore = 0;

        for (BallEvent ball : BallEventLog.of(innings).activeEvents()) {
            ExtraType extra = ball.getExtraType();
            runningScore += ball.getTotalRuns();
            switch (extra) {
                case WIDE -> wides += ball.getExtraRuns();
                case NO_BALL -> noBalls += ball.getExtraRuns();
                case BYE -> byes += ball.getExtraRuns();
                case LEG_BYE -> legByes += ball.getExtraRuns();
                case PENALTY -> penalties += ball.getExtraRuns();
                case NONE -> { }
            }

            BattingLine bat = batting.computeIfAbsent(ball.getBatsmanName(), n -> new BattingLine());
            if (ball.isLegalDelivery() || extra == ExtraType.NO_BALL) bat.balls++;
            if (extra != ExtraType.WIDE && extra != ExtraType.BYE && extra != ExtraType.LEG_BYE) {
                bat.runs += ball.getRunsScored();
            }
            if (ball.isBoundaryFour()) bat.fours++;
            if (ball.isBoundarySix()) bat.sixes++;

            if (ball.isWicket() && ball.getDismissedBatsman() != null) {
                BattingLine out = batting.computeIfAbsent(ball.getDismissedBatsman(), n -> new BattingLine());
                out.howOut = dismissalText(ball);
                out.bowler = ball.getBowlerName();
                fallOfWickets.add(new FallOfWicket(fallOfWickets.size() + 1, ball.getDismissedBatsman(),
                        runningScore, ball.getOverBall()));
            }

            BowlingFigures bowl = bowling.computeIfAbsent(ball.getBowlerName(), n -> new BowlingFigures(ball.getOverNumber()));
            bowl.record(ball);
        }

        // batsmen still at the crease who have not faced yet
        if (innings.getStrikerName() != null) batting.putIfAbsent(innings.getStrikerName(), new BattingLine());
        if (innings.getNonStrikerName() != null) batting.putIfAbsent(innings.getNonStrikerName(), new BattingLine());

        InningsScorecard card = new InningsScorecard();
        card.setInningsNumber(innings.getInningsNumber());
        card.setBattingTeam(innings.getBattingTeam());
        card.setBowlingTeam(innings.getBowlingTeam());
        card.setTotalRuns(innings.getTotalRuns());
        card.setTotalWickets(innings.getTotalWickets());
        card.setTotalOvers(innings.getOversDisplay());
        card.setTarget(innings.getTarget());
        card.setExtras(ExtrasSummary.of(wides, noBalls, byes, legByes, penalties));
        batting.forEach((name, line) -> card.getBatsmen().add(line.toStats(name)));
        bowling.forEach((name, figures) -> card.getBowlers().add(figures.toStats(name)));
        card.getFallOfWickets().addAll(fallOfWickets);
        return card;
    }

    static String dismissalText(BallEvent ball) {
        DismissalType type = ball.getDismissalType();
        String bowler = ball.getBowlerName();
        String fielder = ball.getFielderName();
        if (type == null) return "out";
        return switch (type) {
            case BOWLED -> "b " + bowler;
            case LBW -> "lbw b " + bowler;
            case CAUGHT -> fielder != null ? "c " + fielder + " b " + bowler : "c & b " + bowler;
            case STUMPED -> fielder != null ? "st " + fielder + " b " + bowler : type.getLabel();
            case RUN_OUT -> fielder != null ? "run out (" + fielder + ")" : "run out";
            case HIT_WICKET -> "hit wicket b " + bowler;
            default -> type.getLabel();
        };
    }

    static String oversText(int legalBalls) {
        int overs = legalBalls / ScoringEngine.BALLS_PER_OVER;
        int rem = legalBalls % ScoringEngine.BALLS_PER_OVER;
        return rem == 0 ? String.valueOf(overs) : overs + "." + rem;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static final class BattingLine {
        int runs;
        int balls;
        int fours;
        int sixes;
        String howOut = "not out";
        String bowler;

        BatsmanStats toStats(String name) {
            double sr = balls > 0 ? round2(runs * 100.0 / balls) : 0.0;
            return new BatsmanStats(name, runs, balls, fours, sixes, sr, howOut, bowler);
        }
    }

    private static final class BowlingFigures {
        int balls;
        int runs;
        int wickets;
        int wides;
        int noBalls;
        int maidens;
        // current spell over: reset whenever the bowler shows up in a different over
        int overNumber;
        int overRuns;
        int overBalls;

        BowlingFigures(int firstOver) {
            this.overNumber = firstOver;
        }

        void record(BallEvent ball) {
            if (ball.getOverNumber() != overNumber) {
                closeOver();
                overNumber = ball.getOverNumber();
            }
            int conceded = switch (ball.getExtraType()) {
                case WIDE -> ball.getExtraRuns();
                case NO_BALL -> ball.getExtraRuns() + ball.getRunsScored();
                case BYE, LEG_BYE -> 0;
                case NONE, PENALTY -> ball.getRunsScored();
            };
            runs += conceded;
            overRuns += conceded;
            if (ball.isLegalDelivery()) {
                balls++;
                overBalls++;
            }
            if (ball.getExtraType() == ExtraType.WIDE) wides++;
            if (ball.getExtraType() == ExtraType.NO_BALL) noBalls++;
            if (ball.isWicket() && ball.getDismissalType() != null && ball.getDismissalType().isCreditedToBowler()) {
                wickets++;
            }
        }

        void closeOver() {
            if (overBalls == ScoringEngine.BALLS_PER_OVER && overRuns == 0) maidens++;
            overRuns = 0;
            overBalls = 0;
        }

        BowlerStats toStats(String name) {
            closeOver();
            double economy = balls > 0 ? round2(runs / (balls / (double) ScoringEngine.BALLS_PER_OVER)) : 0.0;
            return new BowlerStats(name, oversText(balls), maidens, runs, wickets, economy, wides, noBalls);
        }
    }
}
