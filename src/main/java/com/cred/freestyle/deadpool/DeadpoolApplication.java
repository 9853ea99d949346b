package com.cred.freestyle.deadpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for the Deadpool draft engine.
 *
 * System Overview:
 * - Players draft living celebrities into a yearly pool, one pick per turn
 * - A candidate can be held by at most one player per season
 * - Each player holds at most 20 active (living) picks per season
 * - Picks score when the candidate dies during the season
 * - Between seasons, surviving picks carry forward and the draft order is reversed from the leaderboard
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: draft, scoring, season setup and season transition
 * - Data Access Layer: repositories over a key/sort-key entity store (PostgreSQL or in-memory)
 * - Infrastructure Layer: Kafka events, CloudWatch metrics, store-backed lease locks
 *
 * A season transition can also run once at startup with
 * {@code --deadpool.transition.run.enabled=true --deadpool.transition.run.from-year=2024 --deadpool.transition.run.to-year=2025}.
 *
 * @author Deadpool Team
 */
@SpringBootApplication
public class DeadpoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeadpoolApplication.class, args);
    }
}
