package com.cred.freestyle.deadpool.testutil;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.Player;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Builder class for creating test data objects.
 * Provides fluent API for building domain models with sensible defaults.
 */
public class TestDataBuilder {

    /**
     * Distinct real-world names; no two are within fuzzy-match distance of each other.
     */
    public static final String[] CANDIDATE_NAMES = {
            "Betty White", "Jimmy Carter", "Dick Van Dyke", "Mel Brooks", "Willie Nelson",
            "Queen Margrethe", "Clint Eastwood", "Gene Hackman", "Paul McCartney", "Ozzy Osbourne",
            "Jane Fonda", "Rupert Murdoch", "Warren Buffett", "Tony Bennett", "Angela Lansbury",
            "Noam Chomsky", "Pope Benedict", "Sidney Poitier", "Loretta Lynn", "Henry Kissinger",
            "Bob Barker", "Shelley Duvall", "Quincy Jones", "Kris Kristofferson", "Maggie Smith"
    };

    /**
     * Builder for Player
     */
    public static class PlayerBuilder {
        private String id = "player-" + UUID.randomUUID();
        private String firstName = "Test";
        private String lastName = "Player";
        private Instant createdAt = Instant.parse("2024-01-01T00:00:00Z");

        public PlayerBuilder id(String id) {
            this.id = id;
            return this;
        }

        public PlayerBuilder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public PlayerBuilder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Player build() {
            return Player.builder()
                    .id(id)
                    .firstName(firstName)
                    .lastName(lastName)
                    .createdAt(createdAt)
                    .build();
        }
    }

    /**
     * Builder for Candidate
     */
    public static class CandidateBuilder {
        private String id = "cand-" + UUID.randomUUID();
        private String name = "Test Candidate";
        private String normalizedName;
        private Integer age = 80;
        private LocalDate deathDate;
        private Instant createdAt = Instant.parse("2024-01-01T00:00:00Z");

        public CandidateBuilder id(String id) {
            this.id = id;
            return this;
        }

        public CandidateBuilder name(String name) {
            this.name = name;
            return this;
        }

        public CandidateBuilder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public CandidateBuilder age(Integer age) {
            this.age = age;
            return this;
        }

        public CandidateBuilder diedOn(LocalDate deathDate) {
            this.deathDate = deathDate;
            return this;
        }

        public Candidate build() {
            return Candidate.builder()
                    .id(id)
                    .name(name)
                    .normalizedName(normalizedName != null ? normalizedName : name.toLowerCase())
                    .age(age)
                    .deathDate(deathDate)
                    .createdAt(createdAt)
                    .build();
        }
    }

    public static PlayerBuilder player() {
        return new PlayerBuilder();
    }

    public static CandidateBuilder candidate() {
        return new CandidateBuilder();
    }
}
