package com.cred.freestyle.deadpool.config;

import com.cred.freestyle.deadpool.infrastructure.store.EntityStore;
import com.cred.freestyle.deadpool.infrastructure.store.InMemoryEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans: domain properties, the clock, and the in-memory store for the local profile.
 * The PostgreSQL store registers itself when {@code deadpool.store.type=jpa}.
 *
 * @author Deadpool Team
 */
@Configuration
@EnableConfigurationProperties(DeadpoolProperties.class)
public class EntityStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(EntityStoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "deadpool.store.type", havingValue = "in-memory")
    public EntityStore inMemoryEntityStore() {
        logger.warn("Using in-memory entity store; data is lost on shutdown");
        return new InMemoryEntityStore();
    }
}
