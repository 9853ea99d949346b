package com.cred.freestyle.deadpool.api.controller;

import com.cred.freestyle.deadpool.api.dto.DraftOrderRequest;
import com.cred.freestyle.deadpool.api.dto.TransitionRequest;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord;
import com.cred.freestyle.deadpool.service.SeasonSetupService;
import com.cred.freestyle.deadpool.service.transition.SeasonTransitionService;
import com.cred.freestyle.deadpool.service.transition.TransitionReport;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for season setup and season transitions.
 *
 * Transitions must not overlap live drafting for either season; callers are
 * expected to run them between seasons.
 *
 * @author Deadpool Team
 */
@RestController
@RequestMapping("/api/v1/seasons")
public class SeasonController {

    private static final Logger logger = LoggerFactory.getLogger(SeasonController.class);

    private final SeasonSetupService seasonSetupService;
    private final SeasonTransitionService transitionService;

    public SeasonController(SeasonSetupService seasonSetupService, SeasonTransitionService transitionService) {
        this.seasonSetupService = seasonSetupService;
        this.transitionService = transitionService;
    }

    /**
     * Initialize the draft order of a season that has none.
     *
     * @param year Season year
     * @param request Player ids in draft order
     * @return Created order entries
     */
    @PostMapping("/{year}/draft-order")
    public ResponseEntity<List<DraftOrderEntry>> initializeDraftOrder(
            @PathVariable int year,
            @Valid @RequestBody DraftOrderRequest request
    ) {
        logger.info("Initializing draft order for {} with {} players", year, request.getPlayerIds().size());
        List<DraftOrderEntry> order = seasonSetupService.initializeDraftOrder(year, request.getPlayerIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(order);
    }

    /**
     * Run a season transition. Dry runs write nothing and return the planned outcome.
     *
     * @return 200 with the report; the report's status tells whether validation passed
     */
    @PostMapping("/transitions")
    public ResponseEntity<TransitionReport> runTransition(
            @Valid @RequestBody TransitionRequest request
    ) {
        logger.info("Season transition requested: {} -> {} (dryRun={})",
                request.getFromYear(), request.getToYear(), request.isDryRun());

        TransitionReport report = transitionService.runTransition(
                request.getFromYear(), request.getToYear(), request.isDryRun(), request.isVerbose());

        if (!report.isSuccessful()) {
            logger.warn("Season transition {} -> {} finished with status {}",
                    request.getFromYear(), request.getToYear(), report.getStatus());
        }
        return ResponseEntity.ok(report);
    }

    @GetMapping("/transitions/{fromYear}/{toYear}")
    public ResponseEntity<SeasonTransitionRecord> getTransition(
            @PathVariable int fromYear,
            @PathVariable int toYear
    ) {
        return ResponseEntity.ok(transitionService.getTransitionRecord(fromYear, toYear));
    }
}
