package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.domain.model.Player;
import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for {@link Player} records.
 * Every saved player is also listed in the {@code PLAYERS} registry partition.
 *
 * @author Deadpool Team
 */
@Repository
public class PlayerRepository {

    private final StoreOperations store;

    public PlayerRepository(StoreOperations store) {
        this.store = store;
    }

    public Optional<Player> findById(String playerId) {
        return store.get(KeySchema.player(playerId)).map(PlayerRepository::toPlayer);
    }

    public boolean existsById(String playerId) {
        return findById(playerId).isPresent();
    }

    /**
     * Players by id; unknown ids are omitted.
     */
    public Map<String, Player> findAllById(Collection<String> playerIds) {
        List<StoreKey> keys = new ArrayList<>(playerIds.size());
        for (String playerId : playerIds) {
            keys.add(KeySchema.player(playerId));
        }
        Map<String, Player> players = new LinkedHashMap<>();
        for (StoreItem item : store.batchGet(keys)) {
            Player player = toPlayer(item);
            players.put(player.getId(), player);
        }
        return players;
    }

    public List<Player> findAll() {
        List<String> ids = new ArrayList<>();
        for (StoreItem entry : store.queryByPrefix(KeySchema.PLAYERS_PARTITION, KeySchema.playerRegistryPrefix())) {
            ids.add(entry.getString("playerId"));
        }
        return new ArrayList<>(findAllById(ids).values());
    }

    public Player save(Player player) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("playerId", player.getId());
        putIfNotNull(attributes, "firstName", player.getFirstName());
        putIfNotNull(attributes, "lastName", player.getLastName());
        putIfNotNull(attributes, "createdAt", player.getCreatedAt() == null ? null : player.getCreatedAt().toString());
        store.put(KeySchema.player(player.getId()), attributes);
        store.put(KeySchema.playerRegistryEntry(player.getId()), Map.of("playerId", player.getId()));
        return player;
    }

    private static Player toPlayer(StoreItem item) {
        String createdAt = item.getString("createdAt");
        return Player.builder()
                .id(item.getString("playerId"))
                .firstName(item.getString("firstName"))
                .lastName(item.getString("lastName"))
                .createdAt(createdAt == null ? null : Instant.parse(createdAt))
                .build();
    }

    static void putIfNotNull(Map<String, Object> attributes, String name, Object value) {
        if (value != null) {
            attributes.put(name, value);
        }
    }
}
