package com.cred.freestyle.deadpool.service.transition;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.LeaderboardEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord.TransitionStatus;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.infrastructure.messaging.events.SeasonTransitionEvent;
import com.cred.freestyle.deadpool.testutil.InMemoryEngine;
import com.cred.freestyle.deadpool.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for SeasonTransitionService against real repositories on the in-memory store.
 *
 * Outgoing 2024 season:
 * - alice: 20 picks, one died in 2024 at 70 (80 points)
 * - bob: 2 living picks (0 points)
 * - carol: 1 pick, died in 2024 at 90 (60 points)
 */
@DisplayName("SeasonTransitionService Tests")
class SeasonTransitionServiceTest {

    private static final int FROM = 2024;
    private static final int TO = 2025;
    private static final Instant SEASON_START = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryEngine engine;
    private SeasonTransitionService transitionService;
    private List<Candidate> bobPicks;

    @BeforeEach
    void setUp() {
        engine = new InMemoryEngine();
        transitionService = engine.transitionService;
        engine.startSeason(FROM, "alice", "bob", "carol");

        for (int i = 0; i < 20; i++) {
            LocalDate died = i == 0 ? LocalDate.of(2024, 12, 31) : null;
            engine.seedPick("alice", FROM, engine.seedCandidate(TestDataBuilder.CANDIDATE_NAMES[i], 70, died));
        }
        bobPicks = new ArrayList<>();
        for (int i = 20; i < 22; i++) {
            Candidate candidate = engine.seedCandidate(TestDataBuilder.CANDIDATE_NAMES[i], 85, null);
            engine.seedPick("bob", FROM, candidate);
            bobPicks.add(candidate);
        }
        engine.seedPick("carol", FROM, engine.seedCandidate(TestDataBuilder.CANDIDATE_NAMES[22], 90,
                LocalDate.of(2024, 11, 3)));
    }

    // ========================================
    // Full run Tests
    // ========================================

    @Test
    @DisplayName("runTransition - Reverses the leaderboard into the new draft order")
    void runTransition_ReversedOrder() {
        TransitionReport report = transitionService.runTransition(FROM, TO, false, false);

        assertThat(report.getOutgoingLeaderboard())
                .extracting(LeaderboardEntry::getPlayerId).containsExactly("alice", "carol", "bob");
        assertThat(report.getOutgoingLeaderboard())
                .extracting(LeaderboardEntry::getScore).containsExactly(80, 60, 0);
        assertThat(engine.draftOrderRepository.findByYear(TO))
                .extracting(DraftOrderEntry::getPlayerId).containsExactly("bob", "carol", "alice");
        assertThat(engine.draftOrderRepository.findByYear(TO))
                .extracting(DraftOrderEntry::getPosition).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("runTransition - Carries living picks; 19 carried leaves one open slot")
    void runTransition_CarryForward() {
        // When
        TransitionReport report = transitionService.runTransition(FROM, TO, false, true);

        // Then
        assertThat(report.getStatus()).isEqualTo(TransitionStatus.COMPLETED);
        assertThat(report.isSuccessful()).isTrue();
        assertThat(report.getValidationIssues()).isEmpty();
        assertThat(report.getPicksCarried()).isEqualTo(21);
        assertThat(report.getPicksRemoved()).isEqualTo(2);

        List<Pick> alicePicks = engine.pickRepository.findByPlayerAndYear("alice", TO);
        assertThat(alicePicks).hasSize(19);
        assertThat(alicePicks).allSatisfy(pick -> assertThat(pick.getTimestamp()).isEqualTo(SEASON_START));
        assertThat(engine.capacityRepository.find("alice", TO)).hasValueSatisfying(capacity -> {
            assertThat(capacity.getMaxPicks()).isEqualTo(20);
            assertThat(capacity.getActivePickCount()).isEqualTo(19);
            assertThat(capacity.getAvailableSlots()).isEqualTo(1);
        });
        assertThat(engine.capacityRepository.find("carol", TO)).hasValueSatisfying(capacity ->
                assertThat(capacity.getAvailableSlots()).isEqualTo(20));
        assertThat(engine.pickRepository.findByPlayerAndYear("carol", TO)).isEmpty();

        for (Candidate candidate : bobPicks) {
            assertThat(engine.pickRepository.findClaim(TO, candidate.getId()))
                    .hasValueSatisfying(claim -> assertThat(claim.getPlayerId()).isEqualTo("bob"));
        }

        // outgoing season untouched
        assertThat(engine.pickRepository.findByPlayerAndYear("alice", FROM)).hasSize(20);
    }

    @Test
    @DisplayName("runTransition - Records the transition and publishes a completion event")
    void runTransition_RecordAndEvent() {
        transitionService.runTransition(FROM, TO, false, false);

        SeasonTransitionRecord record = transitionService.getTransitionRecord(FROM, TO);
        assertThat(record.getStatus()).isEqualTo(TransitionStatus.COMPLETED);
        assertThat(record.getAttempts()).isEqualTo(1);
        assertThat(record.getPlayersProcessed()).isEqualTo(3);
        assertThat(record.getPicksCarried()).isEqualTo(21);
        assertThat(record.getPicksRemoved()).isEqualTo(2);
        assertThat(record.getFailedPlayers()).isEmpty();

        ArgumentCaptor<SeasonTransitionEvent> event = ArgumentCaptor.forClass(SeasonTransitionEvent.class);
        verify(engine.eventPublisher).publishSeasonTransition(event.capture());
        assertThat(event.getValue().getStatus()).isEqualTo("COMPLETED");
        assertThat(event.getValue().getPicksCarried()).isEqualTo(21);
    }

    @Test
    @DisplayName("runTransition - Rerun is idempotent and counts the attempt")
    void runTransition_Rerun_Idempotent() {
        transitionService.runTransition(FROM, TO, false, false);
        int itemsAfterFirst = engine.entityStore.size();

        TransitionReport second = transitionService.runTransition(FROM, TO, false, false);

        assertThat(second.getStatus()).isEqualTo(TransitionStatus.COMPLETED);
        assertThat(second.getAttempt()).isEqualTo(2);
        assertThat(second.getPlayers()).allSatisfy(player -> assertThat(player.getPicksCreated()).isZero());
        assertThat(engine.entityStore.size()).isEqualTo(itemsAfterFirst);
        assertThat(engine.pickRepository.findByPlayerAndYear("alice", TO)).hasSize(19);
        assertThat(transitionService.getTransitionRecord(FROM, TO).getAttempts()).isEqualTo(2);
    }

    // ========================================
    // Dry run Tests
    // ========================================

    @Test
    @DisplayName("runTransition - Dry run writes nothing and reports the planned outcome")
    void runTransition_DryRun_NoWrites() {
        // Given
        int itemsBefore = engine.entityStore.size();

        // When
        TransitionReport report = transitionService.runTransition(FROM, TO, true, false);

        // Then
        assertThat(engine.entityStore.size()).isEqualTo(itemsBefore);
        assertThat(engine.draftOrderRepository.findByYear(TO)).isEmpty();
        assertThatThrownBy(() -> transitionService.getTransitionRecord(FROM, TO))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(engine.eventPublisher, never()).publishSeasonTransition(any());

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getValidationIssues()).isEmpty();
        assertThat(report.getNewDraftOrder())
                .extracting(DraftOrderEntry::getPlayerId).containsExactly("bob", "carol", "alice");
        assertThat(report.getPlayers())
                .filteredOn(player -> player.getPlayerId().equals("alice"))
                .singleElement()
                .satisfies(alice -> {
                    assertThat(alice.getCarriedCandidateIds()).hasSize(19);
                    assertThat(alice.getRemovedCandidateIds()).hasSize(1);
                    assertThat(alice.getAvailableSlots()).isEqualTo(1);
                });
        assertThat(report.getStages())
                .filteredOn(StageResult::isWritesSkipped)
                .extracting(StageResult::getStage)
                .containsExactly(TransitionStage.BUILD_DRAFT_ORDER, TransitionStage.CARRY_FORWARD_PICKS,
                        TransitionStage.RECORD_CAPACITY, TransitionStage.FINALIZE);
    }

    @Test
    @DisplayName("runTransition - Every stage is reported in order")
    void runTransition_StagesReported() {
        TransitionReport report = transitionService.runTransition(FROM, TO, false, false);

        assertThat(report.getStages()).extracting(StageResult::getStage).containsExactly(TransitionStage.values());
        assertThat(engine.meterRegistry.find("deadpool.transition.stage.duration").timers()).hasSize(6);
    }

    // ========================================
    // Failure Tests
    // ========================================

    @Test
    @DisplayName("runTransition - A claim held by someone else is a per-player failure")
    void runTransition_ClaimConflict_CompletedWithErrors() {
        // Given
        engine.seasonSetupService.registerPlayer("dave", "Dave", "Early");
        engine.seedPick("dave", TO, bobPicks.get(0));

        // When
        TransitionReport report = transitionService.runTransition(FROM, TO, false, false);

        // Then
        assertThat(report.getStatus()).isEqualTo(TransitionStatus.COMPLETED_WITH_ERRORS);
        assertThat(report.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getPlayerId()).isEqualTo("bob");
            assertThat(failure.getStage()).isEqualTo(TransitionStage.CARRY_FORWARD_PICKS);
        });
        assertThat(report.getValidationIssues())
                .anySatisfy(issue -> {
                    assertThat(issue.getPlayerId()).isEqualTo("bob");
                    assertThat(issue.getCheck()).isEqualTo(ValidationIssue.Check.PICK_COUNT);
                });
        assertThat(engine.pickRepository.findByPlayerAndYear("bob", TO)).hasSize(1);
        assertThat(engine.pickRepository.findByPlayerAndYear("alice", TO)).hasSize(19);
        assertThat(transitionService.getTransitionRecord(FROM, TO).getFailedPlayers()).containsExactly("bob");
    }

    @Test
    @DisplayName("runTransition - Dry run reports the claim conflict a real run would hit")
    void runTransition_ClaimConflict_DryRunMatchesRealRun() {
        // Given
        engine.seasonSetupService.registerPlayer("dave", "Dave", "Early");
        engine.seedPick("dave", TO, bobPicks.get(0));

        // When
        TransitionReport dryRun = transitionService.runTransition(FROM, TO, true, false);
        TransitionReport realRun = transitionService.runTransition(FROM, TO, false, false);

        // Then
        assertThat(dryRun.getStatus()).isEqualTo(TransitionStatus.COMPLETED_WITH_ERRORS);
        assertThat(dryRun.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getPlayerId()).isEqualTo("bob");
            assertThat(failure.getStage()).isEqualTo(TransitionStage.CARRY_FORWARD_PICKS);
        });
        assertThat(outcome(dryRun)).isEqualTo(outcome(realRun));
        assertThat(engine.pickRepository.findClaim(TO, bobPicks.get(0).getId()))
                .hasValueSatisfying(claim -> assertThat(claim.getPlayerId()).isEqualTo("dave"));
    }

    @Test
    @DisplayName("runTransition - Dry run counts picks already made in the target year")
    void runTransition_DryRunCountsExistingTargetPicks() {
        // Given
        Candidate early = engine.seedCandidate(TestDataBuilder.CANDIDATE_NAMES[24], 89, null);
        engine.seedPick("bob", TO, early);

        // When
        TransitionReport dryRun = transitionService.runTransition(FROM, TO, true, false);
        TransitionReport realRun = transitionService.runTransition(FROM, TO, false, false);

        // Then
        assertThat(availableSlots(dryRun, "bob")).isEqualTo(17);
        assertThat(availableSlots(realRun, "bob")).isEqualTo(17);
        assertThat(outcome(dryRun)).isEqualTo(outcome(realRun));
    }

    private static List<String> outcome(TransitionReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("status " + report.getStatus());
        report.getFailures().forEach(failure -> lines.add("failure " + failure.getPlayerId() + " " + failure.getStage()));
        report.getValidationIssues().forEach(issue -> lines.add("issue " + issue.getPlayerId() + " " + issue.getCheck()));
        lines.sort(null);
        return lines;
    }

    private static int availableSlots(TransitionReport report, String playerId) {
        return report.getPlayers().stream()
                .filter(player -> player.getPlayerId().equals(playerId))
                .findFirst()
                .orElseThrow()
                .getAvailableSlots();
    }

    @Test
    @DisplayName("runTransition - Target year must follow the source year")
    void runTransition_YearsOutOfOrder() {
        assertThatThrownBy(() -> transitionService.runTransition(TO, FROM, false, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> transitionService.runTransition(FROM, FROM, false, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("runTransition - Source year without an order is not found")
    void runTransition_NoOrder() {
        assertThatThrownBy(() -> transitionService.runTransition(2019, 2020, false, false))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
