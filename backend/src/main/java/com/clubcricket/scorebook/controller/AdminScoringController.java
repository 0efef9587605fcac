package com.clubcricket.scorebook.controller;

import com.clubcricket.scorebook.model.ScoringAudit;
import com.clubcricket.scorebook.repository.ScoringAuditRepository;
import com.clubcricket.scorebook.scoring.RebuildReport;
import com.clubcricket.scorebook.service.MatchService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
public class AdminScoringController {

    private final MatchService matchService;
    private final ScoringAuditRepository auditRepository;

    public AdminScoringController(MatchService matchService, ScoringAuditRepository auditRepository) {
        this.matchService = matchService;
        this.auditRepository = auditRepository;
    }

    @PostMapping("/matches/{id}/innings/{number}/rebuild")
    public Map<String, Object> rebuild(@PathVariable("id") Long id, @PathVariable("number") int number) {
        RebuildReport report = matchService.rebuildInnings(id, number);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("matchId", id);
        resp.put("inningsNumber", report.inningsNumber());
        resp.put("activeEvents", report.activeEvents());
        resp.put("drifted", report.drifted());
        resp.put("corrections", report.corrections());
        return resp;
    }

    @GetMapping("/matches/{id}/audit")
    public List<ScoringAudit> audit(@PathVariable("id") Long id) {
        return auditRepository.findByMatchIdOrderByTimestampAscIdAsc(id);
    }
}
