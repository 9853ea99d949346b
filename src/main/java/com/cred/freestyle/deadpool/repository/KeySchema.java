package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;

/**
 * Encoding of domain identifiers into entity store keys.
 *
 * Layout:
 * - PLAYER#{id} / DETAILS                       player profile
 * - PLAYERS / PLAYER#{id}                       registry of all players
 * - CANDIDATE#{id} / DETAILS                    candidate
 * - CANDIDATE_INDEX#{first char} / NAME#{norm}  normalized-name claim, one per candidate
 * - PLAYER#{id} / PICK#{year}#{candidateId}     per-player pick row
 * - YEAR#{year} / PICK#{candidateId}            global per-year pick claim
 * - YEAR#{year} / ORDER#{pos:02d}#PLAYER#{id}   draft order entry
 * - PLAYER#{id} / DRAFT_SLOTS#{year}            capacity record
 * - PLAYER#{id} / DRAFT_LOCK#{year}             per-player draft lease
 * - TRANSITION#{from}_TO_{to} / METADATA        season transition record
 *
 * @author Deadpool Team
 */
public final class KeySchema {

    public static final String DETAILS = "DETAILS";
    public static final String METADATA = "METADATA";
    public static final String PLAYERS_PARTITION = "PLAYERS";

    private static final String PLAYER = "PLAYER#";
    private static final String CANDIDATE = "CANDIDATE#";
    private static final String CANDIDATE_INDEX = "CANDIDATE_INDEX#";
    private static final String NAME = "NAME#";
    private static final String YEAR = "YEAR#";
    private static final String PICK = "PICK#";
    private static final String ORDER = "ORDER#";
    private static final String DRAFT_SLOTS = "DRAFT_SLOTS#";
    private static final String DRAFT_LOCK = "DRAFT_LOCK#";
    private static final String TRANSITION = "TRANSITION#";

    private KeySchema() {
    }

    public static StoreKey player(String playerId) {
        return StoreKey.of(playerPartition(playerId), DETAILS);
    }

    public static StoreKey playerRegistryEntry(String playerId) {
        return StoreKey.of(PLAYERS_PARTITION, PLAYER + playerId);
    }

    public static String playerRegistryPrefix() {
        return PLAYER;
    }

    public static String playerPartition(String playerId) {
        return PLAYER + playerId;
    }

    public static StoreKey candidate(String candidateId) {
        return StoreKey.of(CANDIDATE + candidateId, DETAILS);
    }

    /**
     * Name claim for a normalized name. Names are bucketed by first character
     * so that fuzzy matching scans one partition.
     */
    public static StoreKey candidateName(String normalizedName) {
        return StoreKey.of(candidateIndexPartition(bucketOf(normalizedName)), NAME + normalizedName);
    }

    public static String candidateIndexPartition(char bucket) {
        return CANDIDATE_INDEX + bucket;
    }

    public static String candidateNamePrefix() {
        return NAME;
    }

    public static char bucketOf(String normalizedName) {
        return normalizedName.isEmpty() ? '_' : normalizedName.charAt(0);
    }

    public static StoreKey playerPick(String playerId, int year, String candidateId) {
        return StoreKey.of(playerPartition(playerId), playerPickPrefix(year) + candidateId);
    }

    public static String playerPickPrefix(int year) {
        return PICK + year + "#";
    }

    public static StoreKey pickClaim(int year, String candidateId) {
        return StoreKey.of(yearPartition(year), PICK + candidateId);
    }

    public static String pickClaimPrefix() {
        return PICK;
    }

    public static StoreKey draftOrderEntry(int year, int position, String playerId) {
        return StoreKey.of(yearPartition(year), String.format("%s%02d#%s%s", ORDER, position, PLAYER, playerId));
    }

    public static String draftOrderPrefix() {
        return ORDER;
    }

    public static String yearPartition(int year) {
        return YEAR + year;
    }

    public static StoreKey draftCapacity(String playerId, int year) {
        return StoreKey.of(playerPartition(playerId), DRAFT_SLOTS + year);
    }

    public static StoreKey draftLock(String playerId, int year) {
        return StoreKey.of(playerPartition(playerId), DRAFT_LOCK + year);
    }

    public static StoreKey seasonTransition(int fromYear, int toYear) {
        return StoreKey.of(TRANSITION + fromYear + "_TO_" + toYear, METADATA);
    }
}
