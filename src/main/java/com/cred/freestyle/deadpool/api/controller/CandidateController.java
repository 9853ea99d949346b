package com.cred.freestyle.deadpool.api.controller;

import com.cred.freestyle.deadpool.api.dto.DeathRequest;
import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.service.CandidateService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for candidate lookup and death recording.
 *
 * @author Deadpool Team
 */
@RestController
@RequestMapping("/api/v1/candidates")
public class CandidateController {

    private final CandidateService candidateService;

    public CandidateController(CandidateService candidateService) {
        this.candidateService = candidateService;
    }

    @GetMapping("/{candidateId}")
    public ResponseEntity<Candidate> getCandidate(@PathVariable String candidateId) {
        return ResponseEntity.ok(candidateService.getCandidate(candidateId));
    }

    @PutMapping("/{candidateId}/death")
    public ResponseEntity<Candidate> recordDeath(
            @PathVariable String candidateId,
            @Valid @RequestBody DeathRequest request
    ) {
        return ResponseEntity.ok(candidateService.recordDeath(candidateId, request.getDeathDate(), request.getAge()));
    }
}
