package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import com.cred.freestyle.deadpool.repository.DraftCapacityRepository;
import com.cred.freestyle.deadpool.repository.DraftOrderRepository;
import com.cred.freestyle.deadpool.repository.PickRepository;
import com.cred.freestyle.deadpool.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link SeasonSnapshot} through the repositories.
 *
 * @author Deadpool Team
 */
@Component
public class SeasonSnapshotLoader {

    private static final Logger logger = LoggerFactory.getLogger(SeasonSnapshotLoader.class);

    private final DraftOrderRepository draftOrderRepository;
    private final PickRepository pickRepository;
    private final CandidateRepository candidateRepository;
    private final PlayerRepository playerRepository;
    private final DraftCapacityRepository capacityRepository;

    public SeasonSnapshotLoader(DraftOrderRepository draftOrderRepository,
                                PickRepository pickRepository,
                                CandidateRepository candidateRepository,
                                PlayerRepository playerRepository,
                                DraftCapacityRepository capacityRepository) {
        this.draftOrderRepository = draftOrderRepository;
        this.pickRepository = pickRepository;
        this.candidateRepository = candidateRepository;
        this.playerRepository = playerRepository;
        this.capacityRepository = capacityRepository;
    }

    public SeasonSnapshot load(int year) {
        List<DraftOrderEntry> order = draftOrderRepository.findByYear(year);
        List<String> playerIds = new ArrayList<>(order.size());
        Map<String, List<Pick>> picksByPlayer = new HashMap<>();
        Set<String> candidateIds = new LinkedHashSet<>();

        for (DraftOrderEntry entry : order) {
            playerIds.add(entry.getPlayerId());
            List<Pick> picks = pickRepository.findByPlayerAndYear(entry.getPlayerId(), year);
            picksByPlayer.put(entry.getPlayerId(), picks);
            for (Pick pick : picks) {
                candidateIds.add(pick.getCandidateId());
            }
        }

        SeasonSnapshot snapshot = new SeasonSnapshot(year, order, picksByPlayer,
                candidateRepository.findAllById(candidateIds),
                playerRepository.findAllById(playerIds),
                capacityRepository.findAll(playerIds, year));
        logger.debug("Loaded season {}: {} players, {} candidates", year, order.size(), candidateIds.size());
        return snapshot;
    }
}
