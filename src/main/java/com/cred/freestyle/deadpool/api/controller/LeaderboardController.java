package com.cred.freestyle.deadpool.api.controller;

import com.cred.freestyle.deadpool.api.dto.ScoreResponse;
import com.cred.freestyle.deadpool.domain.model.LeaderboardEntry;
import com.cred.freestyle.deadpool.service.ScoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * REST controller for scores and the season leaderboard.
 *
 * @author Deadpool Team
 */
@RestController
@RequestMapping("/api/v1/leaderboard")
public class LeaderboardController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    private final ScoringService scoringService;
    private final Clock clock;

    public LeaderboardController(ScoringService scoringService, Clock clock) {
        this.scoringService = scoringService;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<LeaderboardEntry>> getLeaderboard(
            @RequestParam(required = false) Integer year
    ) {
        int season = DraftController.resolveYear(year, clock);
        logger.debug("Fetching leaderboard for {}", season);
        return ResponseEntity.ok(scoringService.computeLeaderboard(season));
    }

    @GetMapping("/players/{playerId}")
    public ResponseEntity<ScoreResponse> getPlayerScore(
            @PathVariable String playerId,
            @RequestParam(required = false) Integer year
    ) {
        int season = DraftController.resolveYear(year, clock);
        return ResponseEntity.ok(new ScoreResponse(playerId, season, scoringService.computeScore(playerId, season)));
    }
}
