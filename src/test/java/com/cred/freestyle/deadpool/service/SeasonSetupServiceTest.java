package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Player;
import com.cred.freestyle.deadpool.exception.DraftOrderExistsException;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.testutil.InMemoryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for SeasonSetupService.
 */
@DisplayName("SeasonSetupService Tests")
class SeasonSetupServiceTest {

    private InMemoryEngine engine;
    private SeasonSetupService setupService;

    @BeforeEach
    void setUp() {
        engine = new InMemoryEngine();
        setupService = engine.seasonSetupService;
        setupService.registerPlayer("alice", "Alice", "Adams");
        setupService.registerPlayer("bob", "Bob", "Brown");
    }

    @Test
    @DisplayName("registerPlayer - Existing id returns the stored player unchanged")
    void registerPlayer_Idempotent() {
        Player again = setupService.registerPlayer("alice", "Someone", "Else");

        assertThat(again.getFirstName()).isEqualTo("Alice");
        assertThat(engine.playerRepository.findAll()).hasSize(2);
    }

    @Test
    @DisplayName("registerPlayer - Missing id is generated")
    void registerPlayer_GeneratesId() {
        Player player = setupService.registerPlayer(null, "Carol", null);

        assertThat(player.getId()).isNotBlank();
        assertThat(engine.playerRepository.existsById(player.getId())).isTrue();
    }

    @Test
    @DisplayName("initializeDraftOrder - Positions follow list order and capacity records are empty")
    void initializeDraftOrder_Success() {
        List<DraftOrderEntry> order = setupService.initializeDraftOrder(2025, List.of("bob", "alice"));

        assertThat(order).extracting(DraftOrderEntry::getPlayerId).containsExactly("bob", "alice");
        assertThat(order).extracting(DraftOrderEntry::getPosition).containsExactly(1, 2);
        assertThat(engine.draftOrderRepository.findByYear(2025)).isEqualTo(order);
        assertThat(engine.capacityRepository.find("alice", 2025)).hasValueSatisfying(capacity -> {
            assertThat(capacity.getMaxPicks()).isEqualTo(20);
            assertThat(capacity.getActivePickCount()).isZero();
            assertThat(capacity.getAvailableSlots()).isEqualTo(20);
        });
    }

    @Test
    @DisplayName("initializeDraftOrder - Second initialization is a conflict")
    void initializeDraftOrder_Exists() {
        setupService.initializeDraftOrder(2025, List.of("alice", "bob"));

        assertThatThrownBy(() -> setupService.initializeDraftOrder(2025, List.of("bob", "alice")))
                .isInstanceOf(DraftOrderExistsException.class);
        assertThat(engine.draftOrderRepository.findByYear(2025))
                .extracting(DraftOrderEntry::getPlayerId).containsExactly("alice", "bob");
    }

    @Test
    @DisplayName("initializeDraftOrder - Invalid input is rejected before any write")
    void initializeDraftOrder_InvalidInput() {
        assertThatThrownBy(() -> setupService.initializeDraftOrder(2025, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> setupService.initializeDraftOrder(2025, List.of("alice", "alice")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> setupService.initializeDraftOrder(2025, List.of("alice", "mallory")))
                .isInstanceOf(ResourceNotFoundException.class);

        assertThat(engine.draftOrderRepository.findByYear(2025)).isEmpty();
    }
}
