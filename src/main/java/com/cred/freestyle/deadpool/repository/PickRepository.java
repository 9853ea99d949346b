package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for {@link Pick}s.
 *
 * A pick is two items: the global claim {@code YEAR#{y} / PICK#{candidateId}}, which
 * enforces one holder per candidate per year, and the per-player row
 * {@code PLAYER#{id} / PICK#{y}#{candidateId}} used for roster queries.
 *
 * @author Deadpool Team
 */
@Repository
public class PickRepository {

    private final StoreOperations store;

    public PickRepository(StoreOperations store) {
        this.store = store;
    }

    /**
     * A player's picks for a year, ordered by candidate id.
     */
    public List<Pick> findByPlayerAndYear(String playerId, int year) {
        List<Pick> picks = new ArrayList<>();
        for (StoreItem item : store.queryByPrefix(KeySchema.playerPartition(playerId), KeySchema.playerPickPrefix(year))) {
            picks.add(toPick(item));
        }
        return picks;
    }

    /**
     * Holder of the (year, candidate) claim, if any.
     */
    public Optional<Pick> findClaim(int year, String candidateId) {
        return store.get(KeySchema.pickClaim(year, candidateId)).map(PickRepository::toPick);
    }

    /**
     * All claims of a year.
     */
    public List<Pick> findClaimsByYear(int year) {
        List<Pick> claims = new ArrayList<>();
        for (StoreItem item : store.queryByPrefix(KeySchema.yearPartition(year), KeySchema.pickClaimPrefix())) {
            claims.add(toPick(item));
        }
        return claims;
    }

    /**
     * Claim the candidate for the pick's year on behalf of the pick's player.
     *
     * @return true if this call took the claim, false if any player already holds it
     */
    public boolean claim(Pick pick) {
        return store.putIfAbsent(KeySchema.pickClaim(pick.getYear(), pick.getCandidateId()), toAttributes(pick));
    }

    /**
     * Release a claim, only if it is still held by the given player.
     */
    public boolean releaseClaim(int year, String candidateId, String playerId) {
        return store.deleteConditional(KeySchema.pickClaim(year, candidateId),
                current -> current.map(item -> playerId.equals(item.getString("playerId"))).orElse(false));
    }

    /**
     * Write the per-player pick row.
     *
     * @return true if created, false if the row already existed
     */
    public boolean createPlayerPick(Pick pick) {
        return store.putIfAbsent(KeySchema.playerPick(pick.getPlayerId(), pick.getYear(), pick.getCandidateId()),
                toAttributes(pick));
    }

    public boolean deletePlayerPick(Pick pick) {
        return store.deleteConditional(KeySchema.playerPick(pick.getPlayerId(), pick.getYear(), pick.getCandidateId()),
                Optional::isPresent);
    }

    private static Map<String, Object> toAttributes(Pick pick) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("playerId", pick.getPlayerId());
        attributes.put("year", pick.getYear());
        attributes.put("candidateId", pick.getCandidateId());
        attributes.put("timestamp", pick.getTimestamp().toString());
        return attributes;
    }

    private static Pick toPick(StoreItem item) {
        return Pick.builder()
                .playerId(item.getString("playerId"))
                .year(item.getInteger("year"))
                .candidateId(item.getString("candidateId"))
                .timestamp(Instant.parse(item.getString("timestamp")))
                .build();
    }
}
