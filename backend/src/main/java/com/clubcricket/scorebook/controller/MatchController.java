package com.clubcricket.scorebook.controller;

import com.clubcricket.scorebook.dto.BallEventResponse;
import com.clubcricket.scorebook.dto.ChangeBowlerRequest;
import com.clubcricket.scorebook.dto.CreateMatchRequest;
import com.clubcricket.scorebook.dto.FullScorecard;
import com.clubcricket.scorebook.dto.MatchListItem;
import com.clubcricket.scorebook.dto.MatchResponse;
import com.clubcricket.scorebook.dto.RecordBallRequest;
import com.clubcricket.scorebook.dto.RecordBallResponse;
import com.clubcricket.scorebook.dto.SetTossRequest;
import com.clubcricket.scorebook.dto.StartInningsRequest;
import com.clubcricket.scorebook.dto.UndoResponse;
import com.clubcricket.scorebook.model.BallEvent;
import com.clubcricket.scorebook.model.Innings;
import com.clubcricket.scorebook.model.MatchStatus;
import com.clubcricket.scorebook.scoring.DeliveryOutcome;
import com.clubcricket.scorebook.service.BallLogCsvExporter;
import com.clubcricket.scorebook.service.MatchService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/matches")
@CrossOrigin(origins = "*")
public class MatchController {

    private final MatchService matchService;
    private final BallLogCsvExporter csvExporter;

    public MatchController(MatchService matchService, BallLogCsvExporter csvExporter) {
        this.matchService = matchService;
        this.csvExporter = csvExporter;
    }

    @GetMapping
    public List<MatchListItem> list(@RequestParam(value = "status", required = false) MatchStatus status) {
        return matchService.list(status).stream().map(MatchListItem::from).toList();
    }

    @GetMapping("/{id}")
    public MatchResponse get(@PathVariable("id") Long id) {
        return MatchResponse.from(matchService.get(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MatchResponse create(@RequestBody CreateMatchRequest req) {
        return MatchResponse.from(matchService.create(req));
    }

    @PostMapping("/{id}/toss")
    public MatchResponse setToss(@PathVariable("id") Long id, @RequestBody SetTossRequest req) {
        return MatchResponse.from(matchService.setToss(id, req));
    }

    @PostMapping("/{id}/innings")
    @ResponseStatus(HttpStatus.CREATED)
    public MatchResponse startInnings(@PathVariable("id") Long id, @RequestBody StartInningsRequest req) {
        Innings innings = matchService.startInnings(id, req);
        return MatchResponse.from(innings.getMatch());
    }

    @PostMapping("/{id}/ball")
    public RecordBallResponse recordBall(@PathVariable("id") Long id, @RequestBody RecordBallRequest req) {
        DeliveryOutcome outcome = matchService.recordBall(id, req.toDelivery());
        return new RecordBallResponse(outcome.overComplete(), outcome.inningsEnded(), outcome.resultSummary(),
                MatchResponse.from(outcome.event().getInnings().getMatch()));
    }

    @PostMapping("/{id}/undo")
    public UndoResponse undo(@PathVariable("id") Long id) {
        BallEvent undone = matchService.undoLastBall(id);
        return new UndoResponse("Last ball undone (" + undone.getOverBall() + ").",
                BallEventResponse.from(undone), MatchResponse.from(undone.getInnings().getMatch()));
    }

    @PostMapping("/{id}/change-bowler")
    public MatchResponse changeBowler(@PathVariable("id") Long id, @RequestBody ChangeBowlerRequest req) {
        return MatchResponse.from(matchService.changeBowler(id, req.getBowlerName()).getMatch());
    }

    @PostMapping("/{id}/swap-strike")
    public MatchResponse swapStrike(@PathVariable("id") Long id) {
        return MatchResponse.from(matchService.swapStrike(id).getMatch());
    }

    @PostMapping("/{id}/end-innings")
    public MatchResponse endInnings(@PathVariable("id") Long id) {
        return MatchResponse.from(matchService.endInnings(id));
    }

    @PostMapping("/{id}/abandon")
    public MatchResponse abandon(@PathVariable("id") Long id) {
        return MatchResponse.from(matchService.abandonMatch(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        matchService.deleteMatch(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/scorecard")
    public FullScorecard scorecard(@PathVariable("id") Long id) {
        return matchService.getScorecard(id);
    }

    @GetMapping(value = "/{id}/innings/{number}/balls.csv")
    public ResponseEntity<String> exportBallLog(@PathVariable("id") Long id, @PathVariable("number") int number) {
        String csv = csvExporter.export(matchService.getInnings(id, number));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"match-" + id + "-innings-" + number + ".csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(csv);
    }
}
