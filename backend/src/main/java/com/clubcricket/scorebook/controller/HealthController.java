package com.clubcricket.scorebook.controller;

import com.clubcricket.scorebook.config.ScoringLimits;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/health")
@CrossOrigin(origins = "*")
public class HealthController {
    private final ScoringLimits limits;

    public HealthController(ScoringLimits limits) {
        this.limits = limits;
    }

    @GetMapping
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "maxOvers", limits.getMaxOvers(),
                "maxRunsPerBall", limits.getMaxRunsPerBall()
        );
    }
}
