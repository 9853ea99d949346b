package com.cred.freestyle.deadpool.api.controller;

import com.cred.freestyle.deadpool.api.dto.DraftRequest;
import com.cred.freestyle.deadpool.api.dto.NextDrafterResponse;
import com.cred.freestyle.deadpool.domain.model.DraftResult;
import com.cred.freestyle.deadpool.domain.model.PickCount;
import com.cred.freestyle.deadpool.domain.model.PickDetail;
import com.cred.freestyle.deadpool.exception.DraftConflictException;
import com.cred.freestyle.deadpool.service.DraftService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for draft operations.
 * Handles next-drafter lookup, pick commits and per-season pick listings.
 *
 * @author Deadpool Team
 */
@RestController
@RequestMapping("/api/v1/drafts")
public class DraftController {

    private static final Logger logger = LoggerFactory.getLogger(DraftController.class);

    private final DraftService draftService;
    private final Clock clock;

    public DraftController(DraftService draftService, Clock clock) {
        this.draftService = draftService;
        this.clock = clock;
    }

    /**
     * Get the player who should draft next.
     *
     * @param year Season year, defaults to the current year
     * @return Next drafter, or {@code eligible=false} when everyone is full
     */
    @GetMapping("/next")
    public ResponseEntity<NextDrafterResponse> getNextDrafter(
            @RequestParam(required = false) Integer year
    ) {
        int season = resolveYear(year, clock);
        NextDrafterResponse response = draftService.getNextDrafter(season)
                .map(drafter -> NextDrafterResponse.of(season, drafter))
                .orElseGet(() -> NextDrafterResponse.noneEligible(season));
        return ResponseEntity.ok(response);
    }

    /**
     * Commit a pick for a player. The candidate is resolved by name and created if new.
     *
     * @param request Player, candidate name and optional year
     * @return Committed pick with the player's remaining slots
     */
    @PostMapping
    public ResponseEntity<DraftResult> commitDraft(
            @Valid @RequestBody DraftRequest request
    ) {
        int season = resolveYear(request.getYear(), clock);
        logger.info("Committing draft - player: {}, candidate: '{}', year: {}",
                request.getPlayerId(), request.getCandidateName(), season);

        try {
            DraftResult result = draftService.commitDraft(request.getPlayerId(), request.getCandidateName(), season);
            return ResponseEntity.status(HttpStatus.CREATED).body(result);
        } catch (DraftConflictException e) {
            logger.warn("Draft rejected - player: {}, candidate: '{}', reason: {}",
                    request.getPlayerId(), request.getCandidateName(), e.getReason());
            throw e; // handled by GlobalExceptionHandler
        }
    }

    @GetMapping("/counts")
    public ResponseEntity<List<PickCount>> getPickCounts(
            @RequestParam(required = false) Integer year
    ) {
        return ResponseEntity.ok(draftService.getPickCounts(resolveYear(year, clock)));
    }

    /**
     * List a player's picks for a season, newest first.
     */
    @GetMapping("/players/{playerId}/picks")
    public ResponseEntity<List<PickDetail>> getPlayerPicks(
            @PathVariable String playerId,
            @RequestParam(required = false) Integer year
    ) {
        return ResponseEntity.ok(draftService.getPlayerPicks(playerId, resolveYear(year, clock)));
    }

    static int resolveYear(Integer year, Clock clock) {
        return year != null ? year : LocalDate.now(clock).getYear();
    }
}
