package com.cred.freestyle.deadpool.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Domain settings bound from the {@code deadpool.*} namespace.
 *
 * @author Deadpool Team
 */
@Data
@ConfigurationProperties(prefix = "deadpool")
public class DeadpoolProperties {

    private Draft draft = new Draft();
    private NameMatching nameMatching = new NameMatching();
    private Transition transition = new Transition();
    private Store store = new Store();
    private Events events = new Events();

    @Data
    public static class Draft {
        /**
         * Maximum active picks a player may hold in one season.
         */
        private int maxPicks = 20;

        /**
         * Lease of the per-player draft lock; expires if the holder dies mid-commit.
         */
        private Duration lockLease = Duration.ofSeconds(30);

        /**
         * How long a commit waits for the per-player lock before giving up.
         */
        private Duration lockWait = Duration.ofSeconds(5);

        private Duration lockRetryBackoff = Duration.ofMillis(25);

        /**
         * Upper bound on candidates scanned in one name bucket when looking for a fuzzy match.
         */
        private int matchScanLimit = 500;
    }

    @Data
    public static class NameMatching {
        private double similarityThreshold = 0.85;
        private int minLengthForFuzzy = 4;
        private Map<String, String> suffixMap = defaultSuffixMap();

        private static Map<String, String> defaultSuffixMap() {
            Map<String, String> map = new LinkedHashMap<>();
            map.put("jr.", "jr");
            map.put("jr", "jr");
            map.put("junior", "jr");
            map.put("sr.", "sr");
            map.put("sr", "sr");
            map.put("senior", "sr");
            map.put("iii", "3");
            map.put("ii", "2");
            return map;
        }
    }

    @Data
    public static class Transition {
        /**
         * Worker threads for per-player carry-forward.
         */
        private int parallelism = 3;

        /**
         * Zone in which the carried picks' season-start timestamp is computed.
         */
        private ZoneId seasonStartZone = ZoneId.of("UTC");

        private Run run = new Run();
    }

    /**
     * One-shot command-line transition.
     */
    @Data
    public static class Run {
        private boolean enabled = false;
        private Integer fromYear;
        private Integer toYear;
        private boolean dryRun = false;
        private boolean verbose = false;
    }

    @Data
    public static class Store {
        /**
         * {@code jpa} or {@code in-memory}.
         */
        private String type = "jpa";
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Events {
        private boolean enabled = true;
        private String draftTopic = "deadpool-draft-events";
        private String seasonTopic = "deadpool-season-events";
    }
}
