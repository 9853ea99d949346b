package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.testutil.InMemoryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for CandidateService death recording.
 */
@DisplayName("CandidateService Tests")
class CandidateServiceTest {

    private InMemoryEngine engine;
    private CandidateService candidateService;
    private Candidate candidate;

    @BeforeEach
    void setUp() {
        engine = new InMemoryEngine();
        candidateService = engine.candidateService;
        candidate = engine.seedCandidate("Gene Hackman", 94, null);
    }

    @Test
    @DisplayName("recordDeath - Stores the date and the age")
    void recordDeath_Success() {
        candidateService.recordDeath(candidate.getId(), LocalDate.of(2025, 2, 18), 95);

        Candidate stored = candidateService.getCandidate(candidate.getId());
        assertThat(stored.getDeathDate()).isEqualTo(LocalDate.of(2025, 2, 18));
        assertThat(stored.getAge()).isEqualTo(95);
        assertThat(stored.getStatus()).isEqualTo(Candidate.CandidateStatus.DECEASED);
    }

    @Test
    @DisplayName("recordDeath - Null age keeps the stored age")
    void recordDeath_NullAge_KeepsAge() {
        candidateService.recordDeath(candidate.getId(), LocalDate.of(2025, 2, 18), null);

        assertThat(candidateService.getCandidate(candidate.getId()).getAge()).isEqualTo(94);
    }

    @Test
    @DisplayName("recordDeath - Future dates and negative ages are rejected")
    void recordDeath_Invalid() {
        assertThatThrownBy(() -> candidateService.recordDeath(candidate.getId(), LocalDate.of(2030, 1, 1), 95))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> candidateService.recordDeath(candidate.getId(), LocalDate.of(2025, 1, 1), -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(candidateService.getCandidate(candidate.getId()).isDeceased()).isFalse();
    }

    @Test
    @DisplayName("getCandidate - Unknown id returns not found")
    void getCandidate_Unknown() {
        assertThatThrownBy(() -> candidateService.getCandidate("nope"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
