package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Player;
import com.cred.freestyle.deadpool.exception.DraftOrderExistsException;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.repository.DraftCapacityRepository;
import com.cred.freestyle.deadpool.repository.DraftOrderRepository;
import com.cred.freestyle.deadpool.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Player registration and first-season setup.
 *
 * @author Deadpool Team
 */
@Service
public class SeasonSetupService {

    private static final Logger logger = LoggerFactory.getLogger(SeasonSetupService.class);

    private final PlayerRepository playerRepository;
    private final DraftOrderRepository draftOrderRepository;
    private final DraftCapacityRepository capacityRepository;
    private final DeadpoolProperties properties;
    private final Clock clock;

    public SeasonSetupService(PlayerRepository playerRepository,
                              DraftOrderRepository draftOrderRepository,
                              DraftCapacityRepository capacityRepository,
                              DeadpoolProperties properties,
                              Clock clock) {
        this.playerRepository = playerRepository;
        this.draftOrderRepository = draftOrderRepository;
        this.capacityRepository = capacityRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Register a player. Registering an id that already exists returns the existing player.
     *
     * @param playerId Player id, or null to generate one
     */
    public Player registerPlayer(String playerId, String firstName, String lastName) {
        if (playerId != null) {
            Optional<Player> existing = playerRepository.findById(playerId);
            if (existing.isPresent()) {
                logger.info("Player {} already registered", playerId);
                return existing.get();
            }
        }
        Player player = Player.builder()
                .id(playerId == null ? UUID.randomUUID().toString() : playerId)
                .firstName(firstName)
                .lastName(lastName)
                .createdAt(clock.instant())
                .build();
        playerRepository.save(player);
        logger.info("Registered player {} ({})", player.getId(), player.getDisplayName());
        return player;
    }

    /**
     * Write the draft order of a year that has none, positions 1..N in list order,
     * and an empty capacity record for every player.
     *
     * @param year Season year
     * @param playerIds Players in draft order
     * @return Written entries
     * @throws IllegalArgumentException if the list is empty or has duplicates
     * @throws ResourceNotFoundException if a player is unknown
     * @throws DraftOrderExistsException if the year already has an order
     */
    public List<DraftOrderEntry> initializeDraftOrder(int year, List<String> playerIds) {
        if (playerIds == null || playerIds.isEmpty()) {
            throw new IllegalArgumentException("Draft order must contain at least one player");
        }
        Set<String> seen = new HashSet<>();
        for (String playerId : playerIds) {
            if (!seen.add(playerId)) {
                throw new IllegalArgumentException("Player " + playerId + " appears more than once in the draft order");
            }
        }
        Map<String, Player> players = playerRepository.findAllById(playerIds);
        for (String playerId : playerIds) {
            if (!players.containsKey(playerId)) {
                throw new ResourceNotFoundException("Player", playerId);
            }
        }
        if (!draftOrderRepository.findByYear(year).isEmpty()) {
            throw new DraftOrderExistsException(year);
        }

        List<DraftOrderEntry> entries = new ArrayList<>(playerIds.size());
        for (int i = 0; i < playerIds.size(); i++) {
            entries.add(DraftOrderEntry.builder().year(year).position(i + 1).playerId(playerIds.get(i)).build());
        }
        if (!draftOrderRepository.createOrder(year, entries)) {
            throw new DraftOrderExistsException(year);
        }

        int maxPicks = properties.getDraft().getMaxPicks();
        Instant now = clock.instant();
        for (String playerId : playerIds) {
            if (capacityRepository.find(playerId, year).isEmpty()) {
                capacityRepository.save(DraftCapacityRecord.of(playerId, year, maxPicks, 0, now));
            }
        }
        logger.info("Initialized {} draft order with {} players", year, entries.size());
        return entries;
    }
}
