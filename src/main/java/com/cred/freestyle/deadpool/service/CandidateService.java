package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Candidate lookups and death recording.
 *
 * @author Deadpool Team
 */
@Service
public class CandidateService {

    private static final Logger logger = LoggerFactory.getLogger(CandidateService.class);

    private final CandidateRepository candidateRepository;
    private final Clock clock;

    public CandidateService(CandidateRepository candidateRepository, Clock clock) {
        this.candidateRepository = candidateRepository;
        this.clock = clock;
    }

    public Candidate getCandidate(String candidateId) {
        return candidateRepository.findById(candidateId)
                .orElseThrow(() -> new ResourceNotFoundException("Candidate", candidateId));
    }

    /**
     * Record a candidate's death. Capacity records are not touched; active counts are
     * always derived from picks and candidates.
     *
     * @param candidateId Candidate id
     * @param deathDate Date of death, not in the future
     * @param age Age to store, or null to keep the current value
     */
    public Candidate recordDeath(String candidateId, LocalDate deathDate, Integer age) {
        if (deathDate.isAfter(LocalDate.now(clock))) {
            throw new IllegalArgumentException("Death date " + deathDate + " is in the future");
        }
        if (age != null && age < 0) {
            throw new IllegalArgumentException("Age must not be negative");
        }
        Candidate candidate = getCandidate(candidateId);
        candidate.setDeathDate(deathDate);
        if (age != null) {
            candidate.setAge(age);
        }
        candidateRepository.save(candidate);
        logger.info("Recorded death of {} ({}) on {}", candidate.getName(), candidateId, deathDate);
        return candidate;
    }
}
