package com.cred.freestyle.deadpool.infrastructure.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for JpaEntityStore using Testcontainers.
 * Exercises the conditional-write queries against a real PostgreSQL database.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaEntityStore.class)
@DisplayName("JpaEntityStore Integration Tests")
class JpaEntityStoreIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("deadpool_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @TestConfiguration
    static class StoreTestConfig {
        @Bean
        ObjectMapper objectMapper() {
            return JsonMapper.builder().findAndAddModules().build();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private JpaEntityStore store;

    @Autowired
    private StoreItemJpaRepository repository;

    private final StoreKey pickKey = StoreKey.of("YEAR#2025", "PICK#c1");

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    // ========================================
    // putIfAbsent Tests
    // ========================================

    @Test
    @DisplayName("putIfAbsent - Second insert for the same key is rejected")
    void putIfAbsent_Conflict() {
        // When
        boolean first = store.putIfAbsent(pickKey, Map.of("playerId", "alice"));
        boolean second = store.putIfAbsent(pickKey, Map.of("playerId", "bob"));

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.get(pickKey)).hasValueSatisfying(item -> {
            assertThat(item.getString("playerId")).isEqualTo("alice");
            assertThat(item.getVersion()).isEqualTo(1L);
        });
    }

    // ========================================
    // putConditional / deleteConditional Tests
    // ========================================

    @Test
    @DisplayName("putConditional - Applies when the condition holds and bumps the version")
    void putConditional_Applies() {
        // Given
        store.putIfAbsent(pickKey, Map.of("playerId", "alice"));

        // When
        boolean applied = store.putConditional(pickKey, Map.of("playerId", "bob"),
                current -> current.isPresent() && "alice".equals(current.get().getString("playerId")));

        // Then
        assertThat(applied).isTrue();
        assertThat(store.get(pickKey)).hasValueSatisfying(item -> {
            assertThat(item.getString("playerId")).isEqualTo("bob");
            assertThat(item.getVersion()).isEqualTo(2L);
        });
    }

    @Test
    @DisplayName("putConditional - Rejected condition leaves the row unchanged")
    void putConditional_Rejected() {
        store.putIfAbsent(pickKey, Map.of("playerId", "alice"));

        boolean applied = store.putConditional(pickKey, Map.of("playerId", "bob"), current -> current.isEmpty());

        assertThat(applied).isFalse();
        assertThat(store.get(pickKey)).hasValueSatisfying(item ->
                assertThat(item.getString("playerId")).isEqualTo("alice"));
    }

    @Test
    @DisplayName("deleteConditional - Deletes only when the condition holds")
    void deleteConditional() {
        store.putIfAbsent(pickKey, Map.of("playerId", "alice"));

        assertThat(store.deleteConditional(pickKey,
                current -> "bob".equals(current.get().getString("playerId")))).isFalse();
        assertThat(store.deleteConditional(pickKey,
                current -> "alice".equals(current.get().getString("playerId")))).isTrue();
        assertThat(store.get(pickKey)).isEmpty();
    }

    // ========================================
    // Query Tests
    // ========================================

    @Test
    @DisplayName("queryByPrefix - Returns matching items sorted by sort key")
    void queryByPrefix_Sorted() {
        // Given
        store.put(StoreKey.of("PLAYER#alice", "PICK#2025#c3"), Map.of("n", 3));
        store.put(StoreKey.of("PLAYER#alice", "PICK#2025#c1"), Map.of("n", 1));
        store.put(StoreKey.of("PLAYER#alice", "PICK#2024#c9"), Map.of("n", 9));
        store.put(StoreKey.of("PLAYER#bob", "PICK#2025#c2"), Map.of("n", 2));

        // When
        List<StoreItem> items = store.queryByPrefix("PLAYER#alice", "PICK#2025#");

        // Then
        assertThat(items).extracting(item -> item.getKey().getSortKey())
                .containsExactly("PICK#2025#c1", "PICK#2025#c3");
    }

    @Test
    @DisplayName("batchGet - Returns only the keys that exist")
    void batchGet_SkipsMissing() {
        store.put(StoreKey.of("CANDIDATE#c1", "META"), Map.of("name", "Betty White"));
        store.put(StoreKey.of("CANDIDATE#c2", "META"), Map.of("name", "Bob Barker"));

        List<StoreItem> items = store.batchGet(List.of(
                StoreKey.of("CANDIDATE#c1", "META"),
                StoreKey.of("CANDIDATE#c2", "META"),
                StoreKey.of("CANDIDATE#missing", "META")));

        assertThat(items).extracting(item -> item.getString("name"))
                .containsExactlyInAnyOrder("Betty White", "Bob Barker");
    }

    @Test
    @DisplayName("put - Overwrites and bumps the version")
    void put_Overwrites() {
        store.put(pickKey, Map.of("playerId", "alice"));
        store.put(pickKey, Map.of("playerId", "carol"));

        assertThat(store.get(pickKey)).hasValueSatisfying(item -> {
            assertThat(item.getString("playerId")).isEqualTo("carol");
            assertThat(item.getVersion()).isEqualTo(2L);
        });
    }
}
