package com.clubcricket.scorebook.service;

import com.clubcricket.scorebook.config.ScoringLimits;
import com.clubcricket.scorebook.dto.CreateMatchRequest;
import com.clubcricket.scorebook.dto.FullScorecard;
import com.clubcricket.scorebook.dto.SetTossRequest;
import com.clubcricket.scorebook.dto.StartInningsRequest;
import com.clubcricket.scorebook.exception.IllegalStateTransitionException;
import com.clubcricket.scorebook.exception.NotFoundException;
import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.InningsStatus;
import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.model.MatchStatus;
import com.clubcricket.scorebook.model.ScoringAudit;
import com.clubcricket.scorebook.notify.MatchEvent;
import com.clubcricket.scorebook.notify.MatchEventNotifier;
import com.clubcricket.scorebook.repository.MatchRepository;
import com.clubcricket.scorebook.repository.ScoringAuditRepository;
import com.clubcricket.scorebook.scoring.Delivery;
import com.clubcricket.scorebook.scoring.DeliveryOutcome;
import com.clubcricket.scorebook.scoring.RebuildReport;
import com.clubcricket.scorebook.scoring.ScorecardDeriver;
import com.clubcricket.scorebook.scoring.ScoringEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Match lifecycle: toss, innings creation and completion, abandonment. Every mutation loads the
 * match under a row lock so deliveries for one match are applied one at a time.
 */
@Service
@Transactional(readOnly = true)
public class MatchService {
    private static final Logger log = LoggerFactory.getLogger(MatchService.class);

    private final MatchRepository matchRepository;
    private final ScoringAuditRepository auditRepository;
    private final ScoringEngine engine;
    private final ScorecardDeriver scorecardDeriver;
    private final ScoringLimits limits;
    private final MatchEventNotifier notifier;
    private final ObjectMapper objectMapper;

    public MatchService(MatchRepository matchRepository,
                        ScoringAuditRepository auditRepository,
                        ScoringEngine engine,
                        ScorecardDeriver scorecardDeriver,
                        ScoringLimits limits,
                        MatchEventNotifier notifier,
                        ObjectMapper objectMapper) {
        this.matchRepository = matchRepository;
        this.auditRepository = auditRepository;
        this.engine = engine;
        this.scorecardDeriver = scorecardDeriver;
        this.limits = limits;
        this.notifier = notifier;
        this.objectMapper = objectMapper;
    }

    public List<Match> list(MatchStatus status) {
        if (status == null) return matchRepository.findAllByOrderByCreatedAtDescIdDesc();
        return matchRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    public Match get(Long matchId) {
        return matchRepository.findById(matchId)
                .orElseThrow(() -> new NotFoundException("Match not found: " + matchId));
    }

    @Transactional
    public Match create(CreateMatchRequest req) {
        String teamA = required(req.getTeamAName(), "Team A name");
        String teamB = required(req.getTeamBName(), "Team B name");
        if (teamA.equalsIgnoreCase(teamB)) {
            throw new IllegalArgumentException("Team names must be different.");
        }
        Integer overs = req.getTotalOvers();
        if (overs == null || overs < 1 || overs > limits.getMaxOvers()) {
            throw new IllegalArgumentException("Total overs must be between 1 and " + limits.getMaxOvers() + ".");
        }
        String venue = req.getVenue() == null || req.getVenue().isBlank() ? null : req.getVenue().trim();
        Match saved = matchRepository.save(new Match(teamA, teamB, overs, venue));
        log.info("[Match][Create] id={} {} v {} ({} overs)", saved.getId(), teamA, teamB, overs);
        return saved;
    }

    @Transactional
    public Match setToss(Long matchId, SetTossRequest req) {
        Match match = lock(matchId);
        if (match.getStatus() != MatchStatus.TOSS) {
            throw new IllegalStateTransitionException("Toss can only be set when match is in TOSS state.");
        }
        String winner = req.getTossWinner() == null ? null : req.getTossWinner().trim();
        if (!match.isParticipant(winner)) {
            throw new IllegalArgumentException("Toss winner must be one of the two teams.");
        }
        if (req.getTossDecision() == null) {
            throw new IllegalArgumentException("Toss decision is required.");
        }
        match.setTossWinner(winner);
        match.setTossDecision(req.getTossDecision());
        match.setStatus(MatchStatus.IN_PROGRESS);
        return match;
    }

    @Transactional
    public Innings startInnings(Long matchId, StartInningsRequest req) {
        Match match = lock(matchId);
        if (match.getStatus() != MatchStatus.IN_PROGRESS && match.getStatus() != MatchStatus.INNINGS_BREAK) {
            throw new IllegalStateTransitionException("Cannot start innings in current match state.");
        }
        if (match.getInnings().size() >= 2) {
            throw new IllegalStateTransitionException("Both innings already exist.");
        }
        if (match.findActiveInnings().isPresent()) {
            throw new IllegalStateTransitionException("An innings is already in progress.");
        }
        String batting = required(req.getBattingTeam(), "Batting team");
        String bowling = required(req.getBowlingTeam(), "Bowling team");
        if (!match.isParticipant(batting)) {
            throw new IllegalArgumentException("Batting team must be one of the match teams.");
        }
        if (!match.isParticipant(bowling)) {
            throw new IllegalArgumentException("Bowling team must be one of the match teams.");
        }
        if (batting.equals(bowling)) {
            throw new IllegalArgumentException("Batting and bowling teams cannot be the same.");
        }
        String striker = required(req.getStrikerName(), "Striker name");
        String nonStriker = required(req.getNonStrikerName(), "Non-striker name");
        String bowler = required(req.getBowlerName(), "Bowler name");
        if (striker.equals(nonStriker)) {
            throw new IllegalArgumentException("Striker and non-striker must be different players.");
        }

        int number = match.getInnings().size() + 1;
        Integer target = null;
        if (number == 2) {
            Innings first = match.findInnings(1)
                    .orElseThrow(() -> new IllegalStateTransitionException("First innings missing."));
            if (first.getBattingTeam().equals(batting)) {
                throw new IllegalArgumentException(batting + " has already batted.");
            }
            target = first.getTotalRuns() + 1;
        }

        Innings innings = new Innings(number, batting, bowling, striker, nonStriker, bowler);
        innings.setTarget(target);
        innings.setStatus(InningsStatus.IN_PROGRESS);
        match.addInnings(innings);
        match.setStatus(MatchStatus.IN_PROGRESS);
        matchRepository.flush();
        notifier.notify(new MatchEvent(match.getId(), MatchEvent.Type.INNINGS_STARTED, number,
                batting + " batting" + (target != null ? ", target " + target : "")));
        return innings;
    }

    @Transactional
    public DeliveryOutcome recordBall(Long matchId, Delivery delivery) {
        Match match = lock(matchId);
        Innings innings = activeInnings(match);
        DeliveryOutcome outcome = engine.apply(match, innings, delivery);
        matchRepository.flush();
        if (outcome.inningsEnded()) {
            announceCompletion(match, innings, outcome.resultSummary());
        }
        return outcome;
    }

    @Transactional
    public BallEvent undoLastBall(Long matchId) {
        Match match = lock(matchId);
        Innings innings = activeInnings(match);
        BallEvent undone = engine.undoLast(innings);
        audit("undo", matchId, Map.of("innings", innings.getInningsNumber(),
                "sequence", undone.getSequenceNumber(), "over", undone.getOverBall()));
        return undone;
    }

    @Transactional
    public Innings changeBowler(Long matchId, String bowlerName) {
        Match match = lock(matchId);
        Innings innings = activeInnings(match);
        if (innings.getCurrentBall() != 0) {
            throw new IllegalStateTransitionException("Bowler can only be changed at the start of an over.");
        }
        innings.setCurrentBowlerName(required(bowlerName, "Bowler name"));
        return innings;
    }

    @Transactional
    public Innings swapStrike(Long matchId) {
        Match match = lock(matchId);
        Innings innings = activeInnings(match);
        innings.swapStrike();
        return innings;
    }

    @Transactional
    public Match endInnings(Long matchId) {
        Match match = lock(matchId);
        Innings innings = activeInnings(match);
        String result = engine.completeInnings(match, innings);
        audit("end-innings", matchId, Map.of("innings", innings.getInningsNumber(),
                "score", innings.getTotalRuns() + "/" + innings.getTotalWickets(), "overs", innings.getOversDisplay()));
        announceCompletion(match, innings, result);
        return match;
    }

    @Transactional
    public Match abandonMatch(Long matchId) {
        Match match = lock(matchId);
        if (match.getStatus().isTerminal()) {
            throw new IllegalStateTransitionException("Cannot abandon a match that is already " + match.getStatus() + ".");
        }
        for (Innings inn : match.getInnings()) {
            if (inn.getStatus() == InningsStatus.IN_PROGRESS) {
                inn.setStatus(InningsStatus.COMPLETED);
            }
        }
        match.setStatus(MatchStatus.ABANDONED);
        match.setResultSummary("Match abandoned");
        audit("abandon", matchId, Map.of("innings", match.getInnings().size()));
        notifier.notify(new MatchEvent(matchId, MatchEvent.Type.MATCH_ABANDONED, null, match.getResultSummary()));
        return match;
    }

    @Transactional
    public void deleteMatch(Long matchId) {
        Match match = lock(matchId);
        if (!match.getStatus().isTerminal()) {
            throw new IllegalStateTransitionException("Only completed or abandoned matches can be deleted.");
        }
        matchRepository.delete(match);
        audit("delete", matchId, Map.of("teams", match.getTeamAName() + " v " + match.getTeamBName(),
                "status", match.getStatus()));
        log.info("[Match][Delete] id={}", matchId);
    }

    public FullScorecard getScorecard(Long matchId) {
        return scorecardDeriver.derive(get(matchId));
    }

    public Innings getInnings(Long matchId, int inningsNumber) {
        return get(matchId).findInnings(inningsNumber)
                .orElseThrow(() -> new NotFoundException("Innings " + inningsNumber + " not found for match " + matchId));
    }

    @Transactional
    public RebuildReport rebuildInnings(Long matchId, int inningsNumber) {
        Match match = lock(matchId);
        Innings innings = match.findInnings(inningsNumber)
                .orElseThrow(() -> new NotFoundException("Innings " + inningsNumber + " not found for match " + matchId));
        RebuildReport report = engine.rebuild(innings);
        audit("rebuild", matchId, Map.of("innings", inningsNumber,
                "activeEvents", report.activeEvents(), "corrections", report.corrections()));
        return report;
    }

    private Match lock(Long matchId) {
        return matchRepository.findByIdForUpdate(matchId)
                .orElseThrow(() -> new NotFoundException("Match not found: " + matchId));
    }

    private Innings activeInnings(Match match) {
        return match.findActiveInnings()
                .orElseThrow(() -> new IllegalStateTransitionException("No active innings found."));
    }

    private void announceCompletion(Match match, Innings innings, String result) {
        notifier.notify(new MatchEvent(match.getId(), MatchEvent.Type.INNINGS_COMPLETED, innings.getInningsNumber(),
                innings.getBattingTeam() + " " + innings.getTotalRuns() + "/" + innings.getTotalWickets()
                        + " (" + innings.getOversDisplay() + ")"));
        if (match.getStatus() == MatchStatus.COMPLETED) {
            notifier.notify(new MatchEvent(match.getId(), MatchEvent.Type.MATCH_COMPLETED, null, result));
        }
    }

    private void audit(String action, Long matchId, Map<String, Object> params) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new TreeMap<>(params));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize audit params for " + action, e);
        }
        auditRepository.save(new ScoringAudit(action, matchId, json));
        log.info("[Audit][{}] matchId={} {}", action, matchId, json);
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required.");
        }
        return value.trim();
    }
}
